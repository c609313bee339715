package com.aceengine.core.repair;

import java.util.Optional;

/**
 * Result of {@link RepairEngine#tryApplyWithRepair}.
 *
 * success=false only when no edit was safe; content is then the untouched original.
 * partialApply=true when some, but not all, edits were kept.
 */
public final class TryApplyResult {

    private final boolean      success;
    private final boolean      partialApply;
    private final String       content;
    private final RepairReport report;

    private TryApplyResult(boolean success, boolean partialApply, String content, RepairReport report) {
        this.success      = success;
        this.partialApply = partialApply;
        this.content      = content;
        this.report       = report;
    }

    public static TryApplyResult clean(String content) {
        return new TryApplyResult(true, false, content, null);
    }

    public static TryApplyResult partial(String content, RepairReport report) {
        return new TryApplyResult(true, true, content, report);
    }

    public static TryApplyResult failed(String original, RepairReport report) {
        return new TryApplyResult(false, false, original, report);
    }

    public boolean                isSuccess()      { return success; }
    public boolean                isPartialApply() { return partialApply; }
    public String                 getContent()     { return content; }
    public Optional<RepairReport> getReport()      { return Optional.ofNullable(report); }

    @Override
    public String toString() {
        return "TryApplyResult{success=" + success + ", partial=" + partialApply
                + ", report=" + report + "}";
    }
}
