package com.aceengine.core.journal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Written before any byte of the target changes. Carries the full pre-image so
 * the file can be restored from the journal alone.
 */
public final class IntentEntry extends JournalEntry {

    @JsonProperty("before_sha")
    private final String beforeSha;

    @JsonProperty("before_size")
    private final long beforeSize;

    @JsonProperty("rule_ids")
    private final List<String> ruleIds;

    @JsonProperty("plan_id")
    private final String planId;

    @JsonProperty("pre_image")
    private final String preImage;

    /** Context fingerprint of the plan, so a later revert can be credited to it. */
    @JsonProperty("context_key")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String contextKey;

    @JsonCreator
    public IntentEntry(
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("file") String file,
            @JsonProperty("before_sha") String beforeSha,
            @JsonProperty("before_size") long beforeSize,
            @JsonProperty("rule_ids") List<String> ruleIds,
            @JsonProperty("plan_id") String planId,
            @JsonProperty("pre_image") String preImage,
            @JsonProperty("context_key") String contextKey
    ) {
        super(timestamp, file);
        this.beforeSha  = beforeSha;
        this.beforeSize = beforeSize;
        this.ruleIds    = ruleIds == null ? List.of() : List.copyOf(ruleIds);
        this.planId     = planId;
        this.preImage   = preImage == null ? "" : preImage;
        this.contextKey = contextKey;
    }

    public String       getBeforeSha()  { return beforeSha; }
    public long         getBeforeSize() { return beforeSize; }
    public List<String> getRuleIds()    { return ruleIds; }
    public String       getPlanId()     { return planId; }
    public String       getPreImage()   { return preImage; }
    public String       getContextKey() { return contextKey; }
}
