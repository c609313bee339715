package com.aceengine.core.learning;

import com.aceengine.core.policy.Thresholds;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.TreeMap;

/**
 * The persisted learning document: {@code {rules, contexts, tuning}}.
 */
public class LearningData {

    public static final String TUNING_ALPHA       = "alpha";
    public static final String TUNING_BETA        = "beta";
    public static final String TUNING_MIN_AUTO    = "min_auto";
    public static final String TUNING_MIN_SUGGEST = "min_suggest";

    @JsonProperty("rules")
    private Map<String, RuleStats> rules = new TreeMap<>();

    @JsonProperty("contexts")
    private Map<String, ContextStats> contexts = new TreeMap<>();

    @JsonProperty("tuning")
    private Map<String, Double> tuning = defaultTuning();

    public static Map<String, Double> defaultTuning() {
        Map<String, Double> tuning = new TreeMap<>();
        tuning.put(TUNING_ALPHA, 0.7);
        tuning.put(TUNING_BETA, 0.3);
        tuning.put(TUNING_MIN_AUTO, Thresholds.DEFAULT_AUTO);
        tuning.put(TUNING_MIN_SUGGEST, Thresholds.DEFAULT_SUGGEST);
        return tuning;
    }

    public Map<String, RuleStats>    getRules()    { return rules; }
    public Map<String, ContextStats> getContexts() { return contexts; }
    public Map<String, Double>       getTuning()   { return tuning; }

    double tuningValue(String key, double fallback) {
        Double value = tuning.get(key);
        return value == null ? fallback : value;
    }

    /** Replaces nulls left by partial documents and restores sorted maps. */
    void normalize() {
        rules    = rules == null ? new TreeMap<>() : new TreeMap<>(rules);
        contexts = contexts == null ? new TreeMap<>() : new TreeMap<>(contexts);
        tuning   = tuning == null ? defaultTuning() : new TreeMap<>(tuning);
        rules.values().removeIf(stats -> stats == null);
        contexts.values().removeIf(stats -> stats == null);
        rules.values().forEach(RuleStats::normalize);
    }
}
