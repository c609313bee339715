package com.aceengine.core.guard;

/**
 * Raised when source is not valid Python. The message mirrors CPython's wording
 * where a direct counterpart exists.
 */
public class PythonSyntaxException extends Exception {

    private final int line;

    public PythonSyntaxException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
