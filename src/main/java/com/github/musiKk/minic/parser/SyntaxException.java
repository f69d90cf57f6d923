package com.github.musiKk.minic.parser;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Fatal grammar mismatch. No tree is produced once this is thrown.
 */
public class SyntaxException extends RuntimeException {

    @Accessors(fluent = true)
    @Getter
    private final int line;

    public SyntaxException(String message, int line) {
        super("line " + line + ": " + message);
        this.line = line;
    }
}
