package com.aceengine.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of reverting one run: files restored, in the order they were restored,
 * and files left alone with the reason.
 */
public final class RevertSummary {

    @JsonProperty("run_id")
    private final String              runId;

    @JsonProperty("revert_run_id")
    private final String              revertRunId;

    @JsonProperty("reverted")
    private final List<String>        reverted;

    @JsonProperty("skipped")
    private final Map<String, String> skipped;

    public RevertSummary(String runId, String revertRunId, List<String> reverted, Map<String, String> skipped) {
        this.runId       = runId;
        this.revertRunId = revertRunId;
        this.reverted    = List.copyOf(reverted);
        this.skipped     = Collections.unmodifiableMap(new TreeMap<>(skipped));
    }

    public String              getRunId()       { return runId; }
    public String              getRevertRunId() { return revertRunId; }
    public List<String>        getReverted()    { return reverted; }
    public Map<String, String> getSkipped()     { return skipped; }

    public boolean isComplete() {
        return skipped.isEmpty();
    }

    @Override
    public String toString() {
        return "RevertSummary{run=" + runId + ", reverted=" + reverted.size() + ", skipped=" + skipped.keySet() + "}";
    }
}
