package com.aceengine.core.policy;

import java.util.OptionalDouble;

/**
 * Caller-supplied scoring inputs. Absent values are derived from the plan.
 */
public final class PolicyContext {

    private static final PolicyContext EMPTY = new PolicyContext(null, null);

    private final Double value;
    private final Double impact;

    private PolicyContext(Double value, Double impact) {
        this.value  = value;
        this.impact = impact;
    }

    public static PolicyContext empty() {
        return EMPTY;
    }

    public static PolicyContext of(double value, double impact) {
        return new PolicyContext(checkUnit("value", value), checkUnit("impact", impact));
    }

    public OptionalDouble getValue() {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public OptionalDouble getImpact() {
        return impact == null ? OptionalDouble.empty() : OptionalDouble.of(impact);
    }

    private static double checkUnit(String name, double v) {
        if (v < 0.0 || v > 1.0 || Double.isNaN(v)) {
            throw new IllegalArgumentException(name + " must be in [0, 1]: " + v);
        }
        return v;
    }
}
