package com.github.musiKk.minic.semantic;

import java.util.Optional;

import com.github.musiKk.minic.parser.CompilationUnit.TypeName;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Type {

    public static class Builtin {
        /** Matches every check; given to names that already produced a diagnostic. */
        public static final Type ANY = new Type("any");
        public static final Type INT = new Type("int");
        public static final Type BOOL = new Type("bool");
        public static final Type CHAR = new Type("char");
        public static final Type VOID = new Type("void");
        public static final Type STRING = new Type("string");
    }

    @Accessors(fluent = true)
    @Getter
    private final String name;

    public static Type of(TypeName typeName) {
        return switch (typeName) {
            case INT -> Builtin.INT;
            case BOOL -> Builtin.BOOL;
            case CHAR -> Builtin.CHAR;
            case VOID -> Builtin.VOID;
        };
    }

    public static ArrayType arrayOf(Type elementType, long size) {
        return new ArrayType(elementType, Optional.of(size));
    }

    public boolean isArray() {
        return false;
    }

    public boolean isAny() {
        return this == Builtin.ANY;
    }

    @Override
    public String toString() {
        return name;
    }

    @EqualsAndHashCode(callSuper = false)
    public static class ArrayType extends Type {
        @Accessors(fluent = true)
        @Getter
        private final Type elementType;
        @Accessors(fluent = true)
        @Getter
        private final Optional<Long> size;

        ArrayType(Type elementType, Optional<Long> size) {
            super(elementType.name() + "[]");
            this.elementType = elementType;
            this.size = size;
        }

        @Override
        public boolean isArray() {
            return true;
        }

        @Override
        public String toString() {
            return elementType + size.map(s -> "[" + s + "]").orElse("[]");
        }
    }
}
