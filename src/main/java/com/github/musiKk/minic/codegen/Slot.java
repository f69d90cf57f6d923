package com.github.musiKk.minic.codegen;

import com.github.musiKk.minic.semantic.Type;

/**
 * Where a name lives at run time: a parameter, a local of the current method
 * or a static field of the generated class.
 */
public record Slot(Kind kind, int index, Type type, String name) {

    public enum Kind {
        ARG, LOCAL, GLOBAL
    }

    public static Slot argument(int index, Type type, String name) {
        return new Slot(Kind.ARG, index, type, name);
    }

    public static Slot local(int index, Type type, String name) {
        return new Slot(Kind.LOCAL, index, type, name);
    }

    public static Slot global(Type type, String name) {
        return new Slot(Kind.GLOBAL, -1, type, name);
    }

    void load(Assembly.MethodBuilder method, String owner) {
        switch (kind) {
            case ARG -> method.emit(Opcode.LDARG, Integer.toString(index));
            case LOCAL -> method.emit(Opcode.LDLOC, Integer.toString(index));
            case GLOBAL -> method.emit(Opcode.LDSFLD, fieldReference(owner));
        }
    }

    void store(Assembly.MethodBuilder method, String owner) {
        switch (kind) {
            case ARG -> method.emit(Opcode.STARG, Integer.toString(index));
            case LOCAL -> method.emit(Opcode.STLOC, Integer.toString(index));
            case GLOBAL -> method.emit(Opcode.STSFLD, fieldReference(owner));
        }
    }

    private String fieldReference(String owner) {
        return IlTypes.of(type) + " " + owner + "::" + name;
    }
}
