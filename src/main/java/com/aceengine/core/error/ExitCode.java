package com.aceengine.core.error;

/**
 * Uniform process exit codes.
 *
 *   0 SUCCESS            — run finished
 *   1 OPERATIONAL_ERROR  — file not found, parse failure of an original, write failure
 *   2 POLICY_DENY        — a safety or policy gate refused the change
 *   3 INVALID_ARGS       — bad configuration or arguments
 */
public enum ExitCode {
    SUCCESS(0),
    OPERATIONAL_ERROR(1),
    POLICY_DENY(2),
    INVALID_ARGS(3);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
