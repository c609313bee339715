package com.aceengine.core.guard;

import com.aceengine.core.filesystem.ContentHasher;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * GuardResult — verdict of one guard run over a proposed file transformation.
 *
 * Produced fresh per check and never mutated. The serialized form carries
 * 16-character prefixes of the content hashes instead of the content itself.
 */
public final class GuardResult {

    private final boolean      passed;
    private final String       file;
    private final String       beforeContent;
    private final String       afterContent;
    private final GuardType    guardType;
    private final List<String> errors;

    private GuardResult(boolean passed, String file, String beforeContent, String afterContent,
                        GuardType guardType, List<String> errors) {
        this.passed        = passed;
        this.file          = file;
        this.beforeContent = beforeContent;
        this.afterContent  = afterContent;
        this.guardType     = guardType;
        this.errors        = List.copyOf(errors);
    }

    public static GuardResult pass(String file, String before, String after, GuardType type) {
        return new GuardResult(true, file, before, after, type, List.of());
    }

    public static GuardResult fail(String file, String before, String after,
                                   GuardType type, List<String> errors) {
        return new GuardResult(false, file, before, after, type, errors);
    }

    @JsonProperty("passed")
    public boolean isPassed() { return passed; }

    @JsonProperty("file")
    public String getFile() { return file; }

    @JsonProperty("guard_type")
    public GuardType getGuardType() { return guardType; }

    @JsonProperty("errors")
    public List<String> getErrors() { return errors; }

    @JsonIgnore
    public String getBeforeContent() { return beforeContent; }

    @JsonIgnore
    public String getAfterContent() { return afterContent; }

    @JsonProperty("before_hash")
    public String beforeHash() {
        return ContentHasher.shortHash(ContentHasher.sha256(beforeContent), 16);
    }

    @JsonProperty("after_hash")
    public String afterHash() {
        return ContentHasher.shortHash(ContentHasher.sha256(afterContent), 16);
    }

    @Override
    public String toString() {
        return "GuardResult{passed=" + passed + ", file='" + file + "', type=" + guardType
                + ", errors=" + errors + "}";
    }
}
