package com.aceengine.core.learning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Hits and reverts for one context fingerprint. */
public class ContextStats {

    @JsonProperty("hits")
    private int hits;

    @JsonProperty("reverts")
    private int reverts;

    public int getHits()    { return hits; }
    public int getReverts() { return reverts; }

    /** reverts / hits, or 0 when there are no hits. */
    @JsonIgnore
    public double getRevertRate() {
        return hits == 0 ? 0.0 : (double) reverts / hits;
    }

    void record(Outcome outcome) {
        hits++;
        if (outcome == Outcome.REVERTED) {
            reverts++;
        }
    }
}
