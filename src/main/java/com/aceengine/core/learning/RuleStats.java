package com.aceengine.core.learning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome counters for one rule, plus consecutive reverts per file.
 *
 * Counters only grow. Rates are over applied + reverted; suggestions and skips do
 * not count as samples.
 */
public class RuleStats {

    @JsonProperty("applied")
    private int applied;

    @JsonProperty("reverted")
    private int reverted;

    @JsonProperty("suggested")
    private int suggested;

    @JsonProperty("skipped")
    private int skipped;

    /** Unix seconds of the last recorded outcome. */
    @JsonProperty("last_updated")
    private double lastUpdated;

    @JsonProperty("consecutive_reverts")
    private Map<String, Integer> consecutiveReverts = new TreeMap<>();

    public int    getApplied()     { return applied; }
    public int    getReverted()    { return reverted; }
    public int    getSuggested()   { return suggested; }
    public int    getSkipped()     { return skipped; }
    public double getLastUpdated() { return lastUpdated; }

    public Map<String, Integer> getConsecutiveReverts() {
        return consecutiveReverts;
    }

    public int consecutiveRevertsFor(String file) {
        return consecutiveReverts.getOrDefault(file, 0);
    }

    @JsonIgnore
    public int getTotalActions() {
        return applied + reverted;
    }

    @JsonIgnore
    public double getRevertRate() {
        int total = getTotalActions();
        return total == 0 ? 0.0 : (double) reverted / total;
    }

    @JsonIgnore
    public double getApplyRate() {
        int total = getTotalActions();
        return total == 0 ? 0.0 : (double) applied / total;
    }

    // ----------------------------------------------------------------
    // Mutators (LearningEngine only)
    // ----------------------------------------------------------------

    void record(Outcome outcome, String file, double nowSeconds) {
        lastUpdated = nowSeconds;
        switch (outcome) {
            case APPLIED   -> applied++;
            case REVERTED  -> reverted++;
            case SUGGESTED -> suggested++;
            case SKIPPED   -> skipped++;
        }
        if (file == null) return;
        if (outcome == Outcome.REVERTED) {
            consecutiveReverts.merge(file, 1, Integer::sum);
        } else if (consecutiveReverts.containsKey(file)) {
            consecutiveReverts.put(file, 0);
        }
    }

    void normalize() {
        if (consecutiveReverts == null) {
            consecutiveReverts = new TreeMap<>();
        } else if (!(consecutiveReverts instanceof TreeMap)) {
            consecutiveReverts = new TreeMap<>(consecutiveReverts);
        }
    }

    @Override
    public String toString() {
        return "RuleStats{applied=" + applied + ", reverted=" + reverted
                + ", suggested=" + suggested + ", skipped=" + skipped + "}";
    }
}
