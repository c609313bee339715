package com.aceengine.core.repair;

import com.aceengine.config.Timestamps;
import com.aceengine.core.edit.Edit;
import com.aceengine.core.edit.EditApplier;
import com.aceengine.core.guard.GuardResult;
import com.aceengine.core.guard.GuardType;
import com.aceengine.core.guard.GuardVerifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * RepairEngine — salvages the largest guard-passing subset of a failing edit set.
 *
 * Edits are sorted by (start_line, end_line) once; every index in the report refers
 * to that order. The full set is tried first. On failure the index range is bisected
 * with an explicit work stack, left half before right half:
 *
 *   candidate = accepted ∪ range, applied to the original content
 *   passes            → range joins accepted
 *   fails, one edit   → that edit is marked failed
 *   fails, more edits → split at the midpoint, both halves queued
 *
 * Accepted edits accumulate, so a later edit is judged together with everything
 * already kept. The search is a pure function of (edits, content, guard): the same
 * inputs always yield the same safe and failed indices.
 */
@Component
public class RepairEngine {

    private static final Logger log = LoggerFactory.getLogger(RepairEngine.class);

    private final GuardVerifier guardVerifier;
    private final Clock         clock;

    public RepairEngine(GuardVerifier guardVerifier, Clock clock) {
        this.guardVerifier = guardVerifier;
        this.clock         = clock;
    }

    /** Repair against the configured {@link GuardVerifier}. */
    public TryApplyResult tryApplyWithRepair(Path file, List<Edit> edits, String original, String runId) {
        return tryApplyWithRepair(file, edits, original, guardVerifier::guardEdit, runId);
    }

    public TryApplyResult tryApplyWithRepair(Path file, List<Edit> edits, String original,
                                             EditGuard guard, String runId) {
        if (edits.isEmpty()) {
            return TryApplyResult.clean(original);
        }

        List<Edit> sorted = EditApplier.sortByPosition(edits);
        int        n      = sorted.size();

        String      merged = EditApplier.apply(original, sorted);
        GuardResult full   = guard.check(file, original, merged);
        if (full.isPassed()) {
            log.debug("[RepairEngine] All {} edits passed guard for {}", n, file);
            return TryApplyResult.clean(merged);
        }

        log.info("[RepairEngine] Guard failed for {} ({}), isolating failing edits among {}",
                file, full.getGuardType(), n);

        SortedSet<Integer> accepted = new TreeSet<>();
        SortedSet<Integer> failed   = new TreeSet<>();
        String             content  = original;
        int                checks   = 1;

        Deque<int[]> work = new ArrayDeque<>();
        pushHalves(work, 0, n, failed);

        while (!work.isEmpty()) {
            int[] range = work.pop();
            int   lo    = range[0];
            int   hi    = range[1];

            SortedSet<Integer> candidate = new TreeSet<>(accepted);
            for (int i = lo; i < hi; i++) candidate.add(i);

            String      attempt = EditApplier.apply(original, sorted, candidate);
            GuardResult result  = guard.check(file, original, attempt);
            checks++;

            if (result.isPassed()) {
                accepted = candidate;
                content  = attempt;
            } else {
                pushHalves(work, lo, hi, failed);
            }
        }

        log.info("[RepairEngine] {}: safe={} failed={} after {} guard checks",
                file, accepted, failed, checks);

        RepairReport.Builder report = RepairReport.builder(runId, file.toString(), n)
                .safeEditIndices(new ArrayList<>(accepted))
                .failedEditIndices(new ArrayList<>(failed))
                .guardFailureReason(formatFailure(full))
                .timestamp(Timestamps.now(clock));

        if (accepted.isEmpty()) {
            report.repairSuggestions(List.of(
                    "All edits failed guard checks",
                    "Review the rule logic or file structure",
                    "Consider filing a bug report if this seems incorrect"));
            return TryApplyResult.failed(original, report.build());
        }

        if (failed.isEmpty()) {
            log.warn("[RepairEngine] Guard for {} rejected the full set but accepted every range", file);
            return TryApplyResult.clean(content);
        }
        report.repairSuggestions(suggestionsFor(full.getGuardType(), new ArrayList<>(failed)));
        return TryApplyResult.partial(content, report.build());
    }

    /**
     * Queues a failing range: a single edit is marked failed, anything larger is
     * split with the left half on top of the stack.
     */
    private static void pushHalves(Deque<int[]> work, int lo, int hi, SortedSet<Integer> failed) {
        if (hi - lo == 1) {
            failed.add(lo);
            return;
        }
        int mid = lo + (hi - lo) / 2;
        work.push(new int[]{mid, hi});
        work.push(new int[]{lo, mid});
    }

    // ================================================================
    // Report text
    // ================================================================

    static String formatFailure(GuardResult result) {
        if (result.getErrors().isEmpty()) {
            return "Guard failed: " + result.getGuardType();
        }
        List<String> first = result.getErrors().subList(0, Math.min(3, result.getErrors().size()));
        return result.getGuardType() + ": " + String.join("; ", first);
    }

    static List<String> suggestionsFor(GuardType type, List<Integer> failed) {
        List<String> suggestions = new ArrayList<>();
        switch (type) {
            case PARSE -> {
                suggestions.add("Syntax error introduced by edit");
                suggestions.add("Review the transformation logic for parse correctness");
            }
            case AST_EQUIV -> {
                suggestions.add("Semantic change detected (syntax tree mismatch)");
                suggestions.add("Edit may have unintended side effects");
            }
            case CST_APPLY -> {
                suggestions.add("Edited source does not survive a lossless round-trip");
                suggestions.add("Check string literals and line endings in the payload");
            }
            default -> { }
        }

        if (failed.size() == 1) {
            suggestions.add("Only edit #" + failed.get(0) + " failed");
        } else {
            suggestions.add("Edits " + failed + " failed guard checks");
        }
        suggestions.add("Manual review recommended before re-attempting");
        return suggestions;
    }
}
