package com.aceengine.core.edit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Finding severity and the value weight the policy assigns to fixing it.
 */
public enum Severity {
    CRITICAL(1.0),
    HIGH(0.75),
    MEDIUM(0.5),
    LOW(0.25),
    INFO(0.1);

    private final double weight;

    Severity(double weight) {
        this.weight = weight;
    }

    public double getWeight() {
        return weight;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
