package com.aceengine.core.guard;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a single verification layer: a pass flag plus the errors that explain a failure.
 */
public final class CheckResult {

    private static final CheckResult OK = new CheckResult(true, List.of());

    private final boolean      ok;
    private final List<String> errors;

    private CheckResult(boolean ok, List<String> errors) {
        this.ok     = ok;
        this.errors = Collections.unmodifiableList(errors);
    }

    public static CheckResult ok() {
        return OK;
    }

    public static CheckResult failed(String error) {
        return new CheckResult(false, List.of(error));
    }

    public static CheckResult failed(List<String> errors) {
        return new CheckResult(false, List.copyOf(errors));
    }

    public boolean      isOk()      { return ok; }
    public List<String> getErrors() { return errors; }

    @Override
    public String toString() {
        return ok ? "CheckResult{ok}" : "CheckResult{failed, errors=" + errors + "}";
    }
}
