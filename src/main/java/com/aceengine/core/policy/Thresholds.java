package com.aceengine.core.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decision thresholds: a score at or above {@code auto} is applied automatically,
 * one in [{@code suggest}, {@code auto}) is suggested, anything lower is denied.
 */
public final class Thresholds {

    public static final double DEFAULT_AUTO    = 0.70;
    public static final double DEFAULT_SUGGEST = 0.50;

    public static final Thresholds DEFAULTS = new Thresholds(DEFAULT_AUTO, DEFAULT_SUGGEST);

    @JsonProperty("auto")
    private final double auto;

    @JsonProperty("suggest")
    private final double suggest;

    public Thresholds(double auto, double suggest) {
        this.auto    = auto;
        this.suggest = suggest;
    }

    public double getAuto()    { return auto; }
    public double getSuggest() { return suggest; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Thresholds)) return false;
        Thresholds t = (Thresholds) o;
        return Double.compare(auto, t.auto) == 0 && Double.compare(suggest, t.suggest) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(auto) * 31 + Double.hashCode(suggest);
    }

    @Override
    public String toString() {
        return String.format("Thresholds{auto=%.2f, suggest=%.2f}", auto, suggest);
    }
}
