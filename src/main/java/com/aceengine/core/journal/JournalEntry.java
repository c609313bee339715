package com.aceengine.core.journal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One line of a run journal. The {@code type} property selects the variant:
 * {@code intent}, {@code success} or {@code revert}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IntentEntry.class,  name = "intent"),
        @JsonSubTypes.Type(value = SuccessEntry.class, name = "success"),
        @JsonSubTypes.Type(value = RevertEntry.class,  name = "revert")
})
public abstract class JournalEntry {

    @JsonProperty("timestamp")
    private final String timestamp;

    @JsonProperty("file")
    private final String file;

    protected JournalEntry(String timestamp, String file) {
        this.timestamp = timestamp;
        this.file      = file;
    }

    public String getTimestamp() { return timestamp; }
    public String getFile()      { return file; }
}
