package com.aceengine.core.analysis;

import com.aceengine.core.edit.Finding;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of one analysis pass.
 *
 * {@code findings} are sorted by (file, line, rule, message) regardless of how many
 * workers produced them. {@code errors} maps a file to the reason its analysis failed.
 */
public final class AnalysisRun {

    private final List<Finding>     findings;
    private final List<Path>        analyzedFiles;
    private final List<Path>        skippedFiles;
    private final Map<Path, String> errors;

    AnalysisRun(List<Finding> findings, List<Path> analyzedFiles, List<Path> skippedFiles, Map<Path, String> errors) {
        this.findings      = List.copyOf(findings);
        this.analyzedFiles = List.copyOf(analyzedFiles);
        this.skippedFiles  = List.copyOf(skippedFiles);
        this.errors        = Collections.unmodifiableMap(new TreeMap<>(errors));
    }

    public List<Finding>     getFindings()      { return findings; }
    public List<Path>        getAnalyzedFiles() { return analyzedFiles; }
    public List<Path>        getSkippedFiles()  { return skippedFiles; }
    public Map<Path, String> getErrors()        { return errors; }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "AnalysisRun{findings=" + findings.size() + ", analyzed=" + analyzedFiles.size()
                + ", skipped=" + skippedFiles.size() + ", errors=" + errors.size() + "}";
    }
}
