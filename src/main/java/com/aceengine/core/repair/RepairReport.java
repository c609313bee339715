package com.aceengine.core.repair;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a repair search over one file's edits.
 *
 * One report per file per run; written once by {@link RepairReportStore} and
 * read-only afterwards. Indices refer to the edits in position order.
 */
public final class RepairReport {

    @JsonProperty("run_id")
    private final String runId;

    @JsonProperty("file")
    private final String file;

    @JsonProperty("total_edits")
    private final int totalEdits;

    @JsonProperty("safe_edits")
    private final int safeEdits;

    @JsonProperty("failed_edits")
    private final int failedEdits;

    @JsonProperty("safe_edit_indices")
    private final List<Integer> safeEditIndices;

    @JsonProperty("failed_edit_indices")
    private final List<Integer> failedEditIndices;

    @JsonProperty("guard_failure_reason")
    private final String guardFailureReason;

    @JsonProperty("repair_suggestions")
    private final List<String> repairSuggestions;

    @JsonProperty("timestamp")
    private final String timestamp;

    private RepairReport(Builder b) {
        this.runId              = b.runId;
        this.file               = b.file;
        this.totalEdits         = b.totalEdits;
        this.safeEditIndices    = List.copyOf(b.safeEditIndices);
        this.failedEditIndices  = List.copyOf(b.failedEditIndices);
        this.safeEdits          = safeEditIndices.size();
        this.failedEdits        = failedEditIndices.size();
        this.guardFailureReason = b.guardFailureReason;
        this.repairSuggestions  = List.copyOf(b.repairSuggestions);
        this.timestamp          = b.timestamp;
    }

    @JsonCreator
    static RepairReport fromJson(
            @JsonProperty("run_id") String runId,
            @JsonProperty("file") String file,
            @JsonProperty("total_edits") int totalEdits,
            @JsonProperty("safe_edit_indices") List<Integer> safeEditIndices,
            @JsonProperty("failed_edit_indices") List<Integer> failedEditIndices,
            @JsonProperty("guard_failure_reason") String guardFailureReason,
            @JsonProperty("repair_suggestions") List<String> repairSuggestions,
            @JsonProperty("timestamp") String timestamp
    ) {
        return builder(runId, file, totalEdits)
                .safeEditIndices(safeEditIndices == null ? List.of() : safeEditIndices)
                .failedEditIndices(failedEditIndices == null ? List.of() : failedEditIndices)
                .guardFailureReason(guardFailureReason)
                .repairSuggestions(repairSuggestions == null ? List.of() : repairSuggestions)
                .timestamp(timestamp == null ? "" : timestamp)
                .build();
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public String        getRunId()              { return runId; }
    public String        getFile()               { return file; }
    public int           getTotalEdits()         { return totalEdits; }
    public int           getSafeEdits()          { return safeEdits; }
    public int           getFailedEdits()        { return failedEdits; }
    public List<Integer> getSafeEditIndices()    { return safeEditIndices; }
    public List<Integer> getFailedEditIndices()  { return failedEditIndices; }
    public String        getGuardFailureReason() { return guardFailureReason; }
    public List<String>  getRepairSuggestions()  { return repairSuggestions; }
    public String        getTimestamp()          { return timestamp; }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(String runId, String file, int totalEdits) {
        return new Builder(runId, file, totalEdits);
    }

    public static final class Builder {
        private final String  runId;
        private final String  file;
        private final int     totalEdits;
        private List<Integer> safeEditIndices    = List.of();
        private List<Integer> failedEditIndices  = List.of();
        private String        guardFailureReason = "";
        private List<String>  repairSuggestions  = List.of();
        private String        timestamp          = "";

        private Builder(String runId, String file, int totalEdits) {
            this.runId      = runId;
            this.file       = file;
            this.totalEdits = totalEdits;
        }

        public Builder safeEditIndices(List<Integer> v)   { this.safeEditIndices = v;    return this; }
        public Builder failedEditIndices(List<Integer> v) { this.failedEditIndices = v;  return this; }
        public Builder guardFailureReason(String v)       { this.guardFailureReason = v; return this; }
        public Builder repairSuggestions(List<String> v)  { this.repairSuggestions = v;  return this; }
        public Builder timestamp(String v)                { this.timestamp = v;          return this; }

        public RepairReport build() { return new RepairReport(this); }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RepairReport)) return false;
        RepairReport r = (RepairReport) o;
        return totalEdits == r.totalEdits
                && Objects.equals(runId, r.runId)
                && Objects.equals(file, r.file)
                && safeEditIndices.equals(r.safeEditIndices)
                && failedEditIndices.equals(r.failedEditIndices)
                && Objects.equals(guardFailureReason, r.guardFailureReason)
                && repairSuggestions.equals(r.repairSuggestions)
                && Objects.equals(timestamp, r.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, file, totalEdits, safeEditIndices, failedEditIndices,
                guardFailureReason, repairSuggestions, timestamp);
    }

    @Override
    public String toString() {
        return "RepairReport{file='" + file + "', safe=" + safeEditIndices
                + ", failed=" + failedEditIndices + "}";
    }
}
