package com.aceengine.core.journal;

import java.util.List;

/**
 * Everything needed to undo one committed modification: the hash the file should
 * have now, the content to restore, and the hash that content must produce.
 */
public final class RevertContext {

    private final String       file;
    private final String       expectedCurrentSha;
    private final String       originalSha;
    private final String       restoreContent;
    private final String       planId;
    private final List<String> ruleIds;
    private final String       contextKey;

    public RevertContext(String file, String expectedCurrentSha, String originalSha,
                         String restoreContent, String planId, List<String> ruleIds,
                         String contextKey) {
        this.file               = file;
        this.expectedCurrentSha = expectedCurrentSha;
        this.originalSha        = originalSha;
        this.restoreContent     = restoreContent;
        this.planId             = planId;
        this.ruleIds            = List.copyOf(ruleIds);
        this.contextKey         = contextKey;
    }

    public String       getFile()               { return file; }
    public String       getExpectedCurrentSha() { return expectedCurrentSha; }
    public String       getOriginalSha()        { return originalSha; }
    public String       getRestoreContent()     { return restoreContent; }
    public String       getPlanId()             { return planId; }
    public List<String> getRuleIds()            { return ruleIds; }

    /** Context fingerprint recorded with the intent, or null for older journals. */
    public String getContextKey() {
        return contextKey;
    }

    @Override
    public String toString() {
        return "RevertContext{file='" + file + "', plan=" + planId + "}";
    }
}
