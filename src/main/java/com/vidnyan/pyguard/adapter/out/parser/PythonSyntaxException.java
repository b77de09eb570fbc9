package com.vidnyan.pyguard.adapter.out.parser;

import lombok.Getter;

/**
 * Raised when the source is not valid Python.
 */
@Getter
public class PythonSyntaxException extends RuntimeException {

    private final int line;
    private final int column;

    public PythonSyntaxException(String message, int line, int column) {
        super(message + " at " + line + ":" + column);
        this.line = line;
        this.column = column;
    }
}
