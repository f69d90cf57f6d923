package com.github.musiKk.minic;

import java.util.Optional;

/**
 * A non-fatal problem found while scanning or analyzing a program.
 */
public record Diagnostic(Kind kind, String message, Optional<Integer> line) {

    public enum Kind {
        LEXICAL, SEMANTIC
    }

    public static Diagnostic lexical(String message, int line) {
        return new Diagnostic(Kind.LEXICAL, message, Optional.of(line));
    }

    public static Diagnostic semantic(String message, int line) {
        return new Diagnostic(Kind.SEMANTIC, message, line > 0 ? Optional.of(line) : Optional.empty());
    }

    @Override
    public String toString() {
        return line.map(l -> "line " + l + ": " + message).orElse(message);
    }
}
