package com.aceengine.core.receipt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Hash-sealed proof that one plan turned {@code before_hash} into {@code after_hash}
 * for one file. Created once per applied plan; immutable.
 *
 * Hashes are raw lowercase hex, without an algorithm prefix.
 * {@code policy_hash} is omitted from the JSON when empty.
 */
public final class Receipt {

    @JsonProperty("plan_id")
    private final String planId;

    @JsonProperty("file")
    private final String file;

    @JsonProperty("before_hash")
    private final String beforeHash;

    @JsonProperty("after_hash")
    private final String afterHash;

    @JsonProperty("parse_valid")
    private final boolean parseValid;

    @JsonProperty("invariants_met")
    private final boolean invariantsMet;

    @JsonProperty("estimated_risk")
    private final double estimatedRisk;

    @JsonProperty("duration_ms")
    private final long durationMs;

    @JsonProperty("timestamp")
    private final String timestamp;

    @JsonProperty("policy_hash")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final String policyHash;

    @JsonCreator
    public Receipt(
            @JsonProperty("plan_id") String planId,
            @JsonProperty("file") String file,
            @JsonProperty("before_hash") String beforeHash,
            @JsonProperty("after_hash") String afterHash,
            @JsonProperty("parse_valid") boolean parseValid,
            @JsonProperty("invariants_met") boolean invariantsMet,
            @JsonProperty("estimated_risk") double estimatedRisk,
            @JsonProperty("duration_ms") long durationMs,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("policy_hash") String policyHash
    ) {
        this.planId        = Objects.requireNonNull(planId, "plan_id");
        this.file          = Objects.requireNonNull(file, "file");
        this.beforeHash    = beforeHash;
        this.afterHash     = afterHash;
        this.parseValid    = parseValid;
        this.invariantsMet = invariantsMet;
        this.estimatedRisk = estimatedRisk;
        this.durationMs    = durationMs;
        this.timestamp     = timestamp;
        this.policyHash    = policyHash == null ? "" : policyHash;
    }

    public String  getPlanId()        { return planId; }
    public String  getFile()          { return file; }
    public String  getBeforeHash()    { return beforeHash; }
    public String  getAfterHash()     { return afterHash; }
    public boolean isParseValid()     { return parseValid; }
    public boolean isInvariantsMet()  { return invariantsMet; }
    public double  getEstimatedRisk() { return estimatedRisk; }
    public long    getDurationMs()    { return durationMs; }
    public String  getTimestamp()     { return timestamp; }
    public String  getPolicyHash()    { return policyHash; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Receipt)) return false;
        Receipt r = (Receipt) o;
        return parseValid == r.parseValid && invariantsMet == r.invariantsMet
                && Double.compare(estimatedRisk, r.estimatedRisk) == 0 && durationMs == r.durationMs
                && planId.equals(r.planId) && file.equals(r.file)
                && Objects.equals(beforeHash, r.beforeHash) && Objects.equals(afterHash, r.afterHash)
                && Objects.equals(timestamp, r.timestamp) && policyHash.equals(r.policyHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(planId, file, beforeHash, afterHash, timestamp);
    }

    @Override
    public String toString() {
        return "Receipt{plan=" + planId + ", file=" + file + ", after=" + afterHash + "}";
    }
}
