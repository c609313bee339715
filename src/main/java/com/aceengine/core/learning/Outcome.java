package com.aceengine.core.learning;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** What happened to a plan, as fed back into learning. */
public enum Outcome {
    APPLIED,
    REVERTED,
    SUGGESTED,
    /** Denied by policy before reaching the write path. */
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
