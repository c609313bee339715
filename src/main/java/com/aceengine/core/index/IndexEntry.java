package com.aceengine.core.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fingerprint of one tracked file.
 *
 * The path is the key of the persisted map, so it is not repeated in the JSON body.
 * {@code clean_runs_count} is the only mutable field: it resets to 0 on any content
 * change and increments once per clean analysis pass.
 */
public class IndexEntry {

    @JsonIgnore
    private final String path;

    @JsonProperty("size")
    private final long size;

    @JsonProperty("sha256")
    private final String sha256;

    @JsonProperty("clean_runs_count")
    private int cleanRunsCount;

    public IndexEntry(String path, long size, String sha256, int cleanRunsCount) {
        this.path           = path;
        this.size           = size;
        this.sha256         = sha256;
        this.cleanRunsCount = cleanRunsCount;
    }

    @JsonCreator
    static IndexEntry fromJson(
            @JsonProperty("size") long size,
            @JsonProperty("sha256") String sha256,
            @JsonProperty("clean_runs_count") int cleanRunsCount
    ) {
        return new IndexEntry(null, size, sha256, cleanRunsCount);
    }

    IndexEntry withPath(String newPath) {
        return new IndexEntry(newPath, size, sha256, cleanRunsCount);
    }

    public String getPath()           { return path; }
    public long   getSize()           { return size; }
    public String getSha256()         { return sha256; }
    public int    getCleanRunsCount() { return cleanRunsCount; }

    void incrementCleanRuns() { cleanRunsCount++; }
    void resetCleanRuns()     { cleanRunsCount = 0; }

    @Override
    public String toString() {
        return String.format("IndexEntry{path='%s', size=%d, sha256=%s, cleanRuns=%d}",
                path, size, sha256.substring(0, Math.min(12, sha256.length())), cleanRunsCount);
    }
}
