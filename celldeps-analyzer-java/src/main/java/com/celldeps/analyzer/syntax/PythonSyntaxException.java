package com.celldeps.analyzer.syntax;

/**
 * Raised by {@link PythonParser} for source that is not valid Python 3.
 * {@link #getMessage()} is the bare message, without the line.
 */
public class PythonSyntaxException extends RuntimeException {

    private final int line;

    public PythonSyntaxException(String message, int line) {
        super(message);
        this.line = line;
    }

    /** 1-based line of the offending token. */
    public int getLine() { return line; }
}
