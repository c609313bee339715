package com.aceengine.core.edit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

/**
 * One issue reported by an analyzer. Immutable.
 *
 * The natural order (file, line, rule) is the order in which merged analysis
 * output is emitted.
 */
public final class Finding implements Comparable<Finding> {

    private static final Comparator<Finding> ORDER = Comparator
            .comparing(Finding::getFile)
            .thenComparingInt(Finding::getLine)
            .thenComparing(Finding::getRule)
            .thenComparing(Finding::getMessage);

    @JsonProperty("file")
    private final String file;

    @JsonProperty("line")
    private final int line;

    @JsonProperty("rule")
    private final String rule;

    @JsonProperty("severity")
    private final Severity severity;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("snippet")
    private final String snippet;

    @JsonCreator
    public Finding(
            @JsonProperty("file") String file,
            @JsonProperty("line") int line,
            @JsonProperty("rule") String rule,
            @JsonProperty("severity") Severity severity,
            @JsonProperty("message") String message,
            @JsonProperty("snippet") String snippet
    ) {
        this.file     = Objects.requireNonNull(file, "file");
        this.line     = line;
        this.rule     = Objects.requireNonNull(rule, "rule");
        this.severity = severity == null ? Severity.MEDIUM : severity;
        this.message  = message == null ? "" : message;
        this.snippet  = snippet == null ? "" : snippet;
    }

    public String   getFile()     { return file; }
    public int      getLine()     { return line; }
    public String   getRule()     { return rule; }
    public Severity getSeverity() { return severity; }
    public String   getMessage()  { return message; }
    public String   getSnippet()  { return snippet; }

    @Override
    public int compareTo(Finding other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Finding)) return false;
        Finding f = (Finding) o;
        return line == f.line && file.equals(f.file) && rule.equals(f.rule)
                && severity == f.severity && message.equals(f.message) && snippet.equals(f.snippet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, rule, severity, message, snippet);
    }

    @Override
    public String toString() {
        return file + ":" + line + " [" + rule + "] " + message;
    }
}
