package com.github.musiKk.minic.codegen;

import static com.github.musiKk.minic.semantic.Type.Builtin.BOOL;
import static com.github.musiKk.minic.semantic.Type.Builtin.CHAR;
import static com.github.musiKk.minic.semantic.Type.Builtin.STRING;
import static com.github.musiKk.minic.semantic.Type.Builtin.VOID;

import com.github.musiKk.minic.semantic.Type;

/** Spelling of source types in the emitted text. */
final class IlTypes {

    private IlTypes() {}

    static String of(Type type) {
        if (type instanceof Type.ArrayType array) {
            return of(array.elementType()) + "[]";
        }
        if (type == BOOL) {
            return "bool";
        }
        if (type == CHAR) {
            return "char";
        }
        if (type == VOID) {
            return "void";
        }
        if (type == STRING) {
            return "string";
        }
        // int and anything the analyzer left untyped
        return "int32";
    }

    static Opcode loadElement(Type elementType) {
        if (elementType == BOOL) {
            return Opcode.LDELEM_I1;
        }
        if (elementType == CHAR) {
            return Opcode.LDELEM_U2;
        }
        return Opcode.LDELEM_I4;
    }

    static Opcode storeElement(Type elementType) {
        if (elementType == BOOL) {
            return Opcode.STELEM_I1;
        }
        if (elementType == CHAR) {
            return Opcode.STELEM_I2;
        }
        return Opcode.STELEM_I4;
    }
}
