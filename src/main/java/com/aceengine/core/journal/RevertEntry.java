package com.aceengine.core.journal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Records an executed rollback from {@code from_sha} back to {@code to_sha}. */
public final class RevertEntry extends JournalEntry {

    @JsonProperty("from_sha")
    private final String fromSha;

    @JsonProperty("to_sha")
    private final String toSha;

    @JsonProperty("reason")
    private final String reason;

    @JsonCreator
    public RevertEntry(
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("file") String file,
            @JsonProperty("from_sha") String fromSha,
            @JsonProperty("to_sha") String toSha,
            @JsonProperty("reason") String reason
    ) {
        super(timestamp, file);
        this.fromSha = fromSha;
        this.toSha   = toSha;
        this.reason  = reason;
    }

    public String getFromSha() { return fromSha; }
    public String getToSha()   { return toSha; }
    public String getReason()  { return reason; }
}
