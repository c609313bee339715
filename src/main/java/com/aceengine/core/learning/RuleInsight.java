package com.aceengine.core.learning;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only view of a rule's learning state, as returned by the reporting queries.
 */
public final class RuleInsight {

    @JsonProperty("rule_id")
    private final String ruleId;

    @JsonProperty("applied")
    private final int applied;

    @JsonProperty("reverted")
    private final int reverted;

    @JsonProperty("revert_rate")
    private final double revertRate;

    @JsonProperty("tuned_threshold")
    private final double tunedThreshold;

    RuleInsight(String ruleId, RuleStats stats, double tunedThreshold) {
        this.ruleId         = ruleId;
        this.applied        = stats.getApplied();
        this.reverted       = stats.getReverted();
        this.revertRate     = stats.getRevertRate();
        this.tunedThreshold = tunedThreshold;
    }

    public String getRuleId()         { return ruleId; }
    public int    getApplied()        { return applied; }
    public int    getReverted()       { return reverted; }
    public double getRevertRate()     { return revertRate; }
    public double getTunedThreshold() { return tunedThreshold; }

    @Override
    public String toString() {
        return String.format("%s: threshold=%.2f revert_rate=%.0f%% (%d applied, %d reverted)",
                ruleId, tunedThreshold, revertRate * 100, applied, reverted);
    }
}
