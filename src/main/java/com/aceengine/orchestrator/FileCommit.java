package com.aceengine.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What happened to one file of one plan.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FileCommit {

    public enum Status {
        /** Every edit passed the guard and was written. */
        COMMITTED,
        /** Repair kept a subset of the edits, which was written. */
        PARTIAL,
        /** No edit passed the guard; the file is untouched. */
        REJECTED,
        /** The edits did not change the content; nothing written. */
        UNCHANGED,
        /** Operational error; nothing written, or the write could not be confirmed. */
        ERROR
    }

    @JsonProperty("file")
    private final String file;

    @JsonProperty("status")
    private final Status status;

    @JsonProperty("receipt_id")
    private final String receiptId;

    @JsonProperty("repair_report")
    private final String repairReport;

    @JsonProperty("message")
    private final String message;

    private FileCommit(String file, Status status, String receiptId, String repairReport, String message) {
        this.file         = file;
        this.status       = status;
        this.receiptId    = receiptId;
        this.repairReport = repairReport;
        this.message      = message;
    }

    static FileCommit committed(String file, String receiptId, String repairReport, boolean partial) {
        return new FileCommit(file, partial ? Status.PARTIAL : Status.COMMITTED, receiptId, repairReport, null);
    }

    static FileCommit rejected(String file, String repairReport, String reason) {
        return new FileCommit(file, Status.REJECTED, null, repairReport, reason);
    }

    static FileCommit unchanged(String file) {
        return new FileCommit(file, Status.UNCHANGED, null, null, null);
    }

    static FileCommit error(String file, String message) {
        return new FileCommit(file, Status.ERROR, null, null, message);
    }

    public String getFile()         { return file; }
    public Status getStatus()       { return status; }
    public String getReceiptId()    { return receiptId; }
    public String getRepairReport() { return repairReport; }
    public String getMessage()      { return message; }

    public boolean isWritten() {
        return status == Status.COMMITTED || status == Status.PARTIAL;
    }

    @Override
    public String toString() {
        return file + ": " + status + (message == null ? "" : " (" + message + ")");
    }
}
