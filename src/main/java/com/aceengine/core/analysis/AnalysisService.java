package com.aceengine.core.analysis;

import com.aceengine.config.JsonMappers;
import com.aceengine.core.edit.Finding;
import com.aceengine.core.error.InvalidArgsException;
import com.aceengine.core.error.OperationalException;
import com.aceengine.core.filesystem.AtomicFileWriter;
import com.aceengine.core.index.ContentIndex;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * AnalysisService — runs an {@link Analyzer} over a file set on a worker pool.
 *
 * Workers only produce findings. Merging, sorting and every ContentIndex update
 * happen on the calling thread after all workers finish, so the output for
 * jobs=1 and jobs=N is identical.
 *
 * Incremental mode skips files that are unchanged since the last run and have
 * been clean for at least {@code ace.index.clean-skip-threshold} passes. After the
 * pass, each analyzed file's clean-run count is incremented when it produced no
 * findings and reset otherwise.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final ContentIndex index;
    private final int          defaultJobs;
    private final int          cleanSkipThreshold;
    private final ObjectMapper mapper;

    public AnalysisService(
            ContentIndex index,
            @Value("${ace.analysis.jobs:4}") int defaultJobs,
            @Value("${ace.index.clean-skip-threshold:3}") int cleanSkipThreshold
    ) {
        if (defaultJobs < 1) {
            throw new InvalidArgsException("ace.analysis.jobs must be at least 1, got " + defaultJobs);
        }
        this.index              = index;
        this.defaultJobs        = defaultJobs;
        this.cleanSkipThreshold = cleanSkipThreshold;
        this.mapper             = JsonMappers.sorted();
    }

    // =========================================================================
    // Analysis
    // =========================================================================

    public AnalysisRun analyze(Analyzer analyzer, Collection<Path> files, boolean incremental) {
        return analyze(analyzer, files, incremental, defaultJobs);
    }

    public AnalysisRun analyze(Analyzer analyzer, Collection<Path> files, boolean incremental, int jobs) {
        if (jobs < 1) {
            throw new InvalidArgsException("jobs must be at least 1, got " + jobs);
        }

        List<Path> candidates = new ArrayList<>();
        for (Path file : new TreeSet<>(files)) {
            candidates.add(file.toAbsolutePath().normalize());
        }

        List<Path> toAnalyze = new ArrayList<>();
        List<Path> skipped   = new ArrayList<>();
        for (Path file : candidates) {
            if (incremental && !index.hasChanged(file) && index.shouldSkipDeepScan(file, cleanSkipThreshold)) {
                skipped.add(file);
            } else {
                toAnalyze.add(file);
            }
        }

        log.info("[AnalysisService] Analyzing {} file(s) with {} worker(s), {} skipped as clean",
                toAnalyze.size(), jobs, skipped.size());

        List<FileOutcome> outcomes = runWorkers(analyzer, toAnalyze, jobs);

        List<Finding>     findings = new ArrayList<>();
        List<Path>        analyzed = new ArrayList<>();
        Map<Path, String> errors   = new TreeMap<>();
        for (FileOutcome outcome : outcomes) {
            if (outcome.error != null) {
                errors.put(outcome.file, outcome.error);
                continue;
            }
            analyzed.add(outcome.file);
            findings.addAll(outcome.findings);
        }
        Collections.sort(findings);

        if (incremental) {
            updateIndex(outcomes);
        }

        AnalysisRun run = new AnalysisRun(findings, analyzed, skipped, errors);
        log.info("[AnalysisService] {}", run);
        return run;
    }

    private List<FileOutcome> runWorkers(Analyzer analyzer, List<Path> files, int jobs) {
        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        if (files.isEmpty()) {
            return outcomes;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(jobs, files.size()), workerThreads());
        try {
            List<Future<List<Finding>>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> analyzer.analyze(file)));
            }

            for (int i = 0; i < files.size(); i++) {
                Path file = files.get(i);
                try {
                    List<Finding> found = futures.get(i).get();
                    outcomes.add(FileOutcome.success(file, found == null ? List.of() : found));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.warn("[AnalysisService] Analysis failed for {}: {}", file, cause.getMessage());
                    outcomes.add(FileOutcome.failure(file, cause.getClass().getSimpleName() + ": " + cause.getMessage()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationalException("Analysis interrupted", e);
        } finally {
            pool.shutdownNow();
        }
        return outcomes;
    }

    private void updateIndex(List<FileOutcome> outcomes) {
        for (FileOutcome outcome : outcomes) {
            if (outcome.error != null) continue;
            try {
                index.addFile(outcome.file, true);
            } catch (IOException e) {
                log.warn("[AnalysisService] Could not index {}: {}", outcome.file, e.getMessage());
                continue;
            }
            if (outcome.findings.isEmpty()) {
                index.incrementCleanRuns(outcome.file);
            } else {
                index.resetCleanRuns(outcome.file);
            }
        }
        try {
            index.save();
        } catch (IOException e) {
            log.warn("[AnalysisService] Index save failed, next run starts from the previous index: {}",
                    e.getMessage());
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ace-analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // =========================================================================
    // Output
    // =========================================================================

    /** Findings as a sorted-key JSON array with a trailing newline. */
    public String findingsJson(List<Finding> findings) {
        List<Finding> sorted = new ArrayList<>(findings);
        Collections.sort(sorted);
        try {
            return JsonMappers.documentWriter(mapper).writeValueAsString(sorted) + "\n";
        } catch (JsonProcessingException e) {
            throw new OperationalException("Failed to serialize findings", e);
        }
    }

    public void writeFindings(List<Finding> findings, Path target) throws IOException {
        AtomicFileWriter.write(target, findingsJson(findings).getBytes(StandardCharsets.UTF_8));
        log.info("[AnalysisService] Wrote {} finding(s) to {}", findings.size(), target);
    }

    public int getDefaultJobs() {
        return defaultJobs;
    }

    // -------------------------------------------------------------------------

    private static final class FileOutcome {
        final Path          file;
        final List<Finding> findings;
        final String        error;

        private FileOutcome(Path file, List<Finding> findings, String error) {
            this.file     = file;
            this.findings = findings;
            this.error    = error;
        }

        static FileOutcome success(Path file, List<Finding> findings) {
            return new FileOutcome(file, findings, null);
        }

        static FileOutcome failure(Path file, String error) {
            return new FileOutcome(file, List.of(), error);
        }
    }
}
