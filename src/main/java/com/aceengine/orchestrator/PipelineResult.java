package com.aceengine.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one {@link TransformationPipeline} run, outcomes in input order.
 */
public final class PipelineResult {

    @JsonProperty("run_id")
    private final String            runId;

    @JsonProperty("dry_run")
    private final boolean           dryRun;

    @JsonProperty("outcomes")
    private final List<PlanOutcome> outcomes;

    private final Path              journalPath;

    PipelineResult(String runId, boolean dryRun, List<PlanOutcome> outcomes, Path journalPath) {
        this.runId       = runId;
        this.dryRun      = dryRun;
        this.outcomes    = List.copyOf(outcomes);
        this.journalPath = journalPath;
    }

    public String            getRunId()    { return runId; }
    public boolean           isDryRun()    { return dryRun; }
    public List<PlanOutcome> getOutcomes() { return outcomes; }

    /** The run's journal, present only when something reached the write path. */
    @JsonIgnore
    public Optional<Path> getJournalPath() {
        return Optional.ofNullable(journalPath);
    }

    public Optional<PlanOutcome> outcomeFor(String planId) {
        return outcomes.stream().filter(o -> o.getPlanId().equals(planId)).findFirst();
    }

    @JsonProperty("counts")
    public Map<PlanOutcome.Status, Integer> counts() {
        Map<PlanOutcome.Status, Integer> counts = new EnumMap<>(PlanOutcome.Status.class);
        for (PlanOutcome outcome : outcomes) {
            counts.merge(outcome.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    public int count(PlanOutcome.Status status) {
        return counts().getOrDefault(status, 0);
    }

    @Override
    public String toString() {
        return "PipelineResult{run=" + runId + ", dryRun=" + dryRun + ", " + counts() + "}";
    }
}
