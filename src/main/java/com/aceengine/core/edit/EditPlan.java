package com.aceengine.core.edit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * EditPlan — a codemod's proposal: edits, the findings they address, the
 * invariants they claim to keep, and an estimated risk in [0, 1].
 *
 * Immutable once created.
 */
public final class EditPlan {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("edits")
    private final List<Edit> edits;

    @JsonProperty("findings")
    private final List<Finding> findings;

    @JsonProperty("invariants")
    private final List<String> invariants;

    @JsonProperty("estimated_risk")
    private final double estimatedRisk;

    @JsonCreator
    public EditPlan(
            @JsonProperty("id") String id,
            @JsonProperty("edits") List<Edit> edits,
            @JsonProperty("findings") List<Finding> findings,
            @JsonProperty("invariants") List<String> invariants,
            @JsonProperty("estimated_risk") double estimatedRisk
    ) {
        if (estimatedRisk < 0.0 || estimatedRisk > 1.0) {
            throw new IllegalArgumentException("estimated_risk must be in [0, 1]: " + estimatedRisk);
        }
        this.id            = Objects.requireNonNull(id, "id");
        this.edits         = edits == null ? List.of() : List.copyOf(edits);
        this.findings      = findings == null ? List.of() : List.copyOf(findings);
        this.invariants    = invariants == null ? List.of() : List.copyOf(invariants);
        this.estimatedRisk = estimatedRisk;
    }

    public String        getId()            { return id; }
    public List<Edit>    getEdits()         { return edits; }
    public List<Finding> getFindings()      { return findings; }
    public List<String>  getInvariants()    { return invariants; }
    public double        getEstimatedRisk() { return estimatedRisk; }

    /** Files touched by this plan, sorted. */
    public SortedSet<String> files() {
        SortedSet<String> files = new TreeSet<>();
        for (Edit edit : edits) files.add(edit.getFile());
        return files;
    }

    public List<Edit> editsFor(String file) {
        List<Edit> result = new ArrayList<>();
        for (Edit edit : edits) {
            if (edit.getFile().equals(file)) result.add(edit);
        }
        return result;
    }

    /** Distinct rule ids of the addressed findings, sorted. */
    @JsonIgnore
    public List<String> getRuleIds() {
        SortedSet<String> rules = new TreeSet<>();
        for (Finding finding : findings) rules.add(finding.getRule());
        return new ArrayList<>(rules);
    }

    /** First rule id in sorted order, or {@code null} for a plan with no findings. */
    public String primaryRule() {
        List<String> rules = getRuleIds();
        return rules.isEmpty() ? null : rules.get(0);
    }

    public int changedLineCount() {
        int total = 0;
        for (Edit edit : edits) total += edit.changedLineCount();
        return total;
    }

    @Override
    public String toString() {
        return "EditPlan{id='" + id + "', edits=" + edits.size() + ", rules=" + getRuleIds() + "}";
    }
}
