package com.aceengine.core.error;

/** Invalid arguments or configuration. */
public class InvalidArgsException extends AceException {

    public InvalidArgsException(String message) {
        super(message, ExitCode.INVALID_ARGS);
    }
}
