package com.aceengine.core.error;

/**
 * Base exception for every engine failure that should reach a caller with an exit code.
 */
public class AceException extends RuntimeException {

    private final ExitCode exitCode;

    public AceException(String message, ExitCode exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public AceException(String message, ExitCode exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public ExitCode getExitCode() {
        return exitCode;
    }

    /** One-line rendering used in logs and operator responses. */
    public String format() {
        return "Error: " + getMessage();
    }
}
