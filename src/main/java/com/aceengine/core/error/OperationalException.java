package com.aceengine.core.error;

/** Runtime failures: unreadable files, unparseable originals, failed writes. */
public class OperationalException extends AceException {

    public OperationalException(String message) {
        super(message, ExitCode.OPERATIONAL_ERROR);
    }

    public OperationalException(String message, Throwable cause) {
        super(message, ExitCode.OPERATIONAL_ERROR, cause);
    }
}
