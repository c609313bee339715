package com.aceengine.orchestrator;

import com.aceengine.core.policy.PolicyEvaluation;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final state of one plan in a run, with the per-file results when it reached the
 * write path.
 */
public final class PlanOutcome {

    public enum Status {
        APPLIED,
        PARTIAL,
        UNCHANGED,
        FAILED,
        SUGGESTED,
        DENIED,
        BUDGET_EXCLUDED,
        /** Dry run: would have been sent to the write path. */
        PLANNED
    }

    @JsonProperty("plan_id")
    private final String           planId;

    @JsonProperty("status")
    private final Status           status;

    @JsonProperty("evaluation")
    private final PolicyEvaluation evaluation;

    @JsonProperty("files")
    private final List<FileCommit> files;

    PlanOutcome(String planId, Status status, PolicyEvaluation evaluation, List<FileCommit> files) {
        this.planId     = planId;
        this.status     = status;
        this.evaluation = evaluation;
        this.files      = files == null ? List.of() : List.copyOf(files);
    }

    static PlanOutcome withoutCommit(PolicyEvaluation evaluation, Status status) {
        return new PlanOutcome(evaluation.getPlanId(), status, evaluation, List.of());
    }

    /**
     * Status of a plan that reached the write path:
     * APPLIED when every file committed in full, PARTIAL when something but not
     * everything was written, UNCHANGED when no file needed a change, FAILED when
     * nothing was written and at least one file was rejected or errored.
     */
    static PlanOutcome fromCommits(PolicyEvaluation evaluation, List<FileCommit> files) {
        boolean anyWritten  = false;
        boolean allComplete = true;
        boolean allUnchanged = true;
        for (FileCommit commit : files) {
            FileCommit.Status s = commit.getStatus();
            if (commit.isWritten()) anyWritten = true;
            if (s != FileCommit.Status.COMMITTED && s != FileCommit.Status.UNCHANGED) allComplete = false;
            if (s != FileCommit.Status.UNCHANGED) allUnchanged = false;
        }

        Status status;
        if (allUnchanged) {
            status = Status.UNCHANGED;
        } else if (anyWritten && allComplete) {
            status = Status.APPLIED;
        } else if (anyWritten) {
            status = Status.PARTIAL;
        } else {
            status = Status.FAILED;
        }
        return new PlanOutcome(evaluation.getPlanId(), status, evaluation, files);
    }

    public String           getPlanId()     { return planId; }
    public Status           getStatus()     { return status; }
    public PolicyEvaluation getEvaluation() { return evaluation; }
    public List<FileCommit> getFiles()      { return files; }

    @Override
    public String toString() {
        return "PlanOutcome{" + planId + " " + status + " files=" + files + "}";
    }
}
