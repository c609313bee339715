package com.aceengine.core.policy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * PolicyDecision — what happens to a scored plan.
 *
 *   AUTO     — score >= auto threshold. Plan goes to the write path.
 *   SUGGEST  — suggest threshold <= score < auto threshold. Recorded, never written.
 *   DENY     — below the suggest threshold, or auto-skipped by learning. Never reaches
 *              the write path. A normal outcome, not an error.
 */
public enum PolicyDecision {
    AUTO,
    SUGGEST,
    DENY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
