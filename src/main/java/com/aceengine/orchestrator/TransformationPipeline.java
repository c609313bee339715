package com.aceengine.orchestrator;

import com.aceengine.communication.EventBus;
import com.aceengine.config.AcePaths;
import com.aceengine.config.ApplyModeResolver;
import com.aceengine.core.edit.Edit;
import com.aceengine.core.edit.EditApplier;
import com.aceengine.core.edit.EditPlan;
import com.aceengine.core.error.AceException;
import com.aceengine.core.error.InvalidArgsException;
import com.aceengine.core.error.OperationalException;
import com.aceengine.core.event.Event;
import com.aceengine.core.event.EventType;
import com.aceengine.core.filesystem.ContentHasher;
import com.aceengine.core.filesystem.FileSystemManager;
import com.aceengine.core.filesystem.FileSystemManager.FileSystemException;
import com.aceengine.core.guard.CheckResult;
import com.aceengine.core.guard.GuardResult;
import com.aceengine.core.guard.GuardType;
import com.aceengine.core.guard.GuardVerifier;
import com.aceengine.core.index.ContentIndex;
import com.aceengine.core.learning.LearningEngine;
import com.aceengine.core.learning.Outcome;
import com.aceengine.core.policy.ChangeBudget;
import com.aceengine.core.policy.PolicyEngine;
import com.aceengine.core.policy.PolicyEvaluation;
import com.aceengine.core.receipt.Receipt;
import com.aceengine.core.receipt.ReceiptStore;
import com.aceengine.core.repair.EditGuard;
import com.aceengine.core.repair.RepairEngine;
import com.aceengine.core.repair.RepairReport;
import com.aceengine.core.repair.RepairReportStore;
import com.aceengine.core.repair.TryApplyResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TransformationPipeline — the single committing path for edit plans.
 *
 * Run flow:
 *   1. Policy     — score every plan against its rule's tuned thresholds
 *                   (deny / suggest are recorded in learning, never written)
 *   2. Priority   — approved plans ordered by 100*R* minus the reverted-context penalty
 *   3. Budget     — keep plans while max-files / max-lines hold
 *   4. Commit     — per file, under that file's lock:
 *                     read → original must parse → edits must not overlap
 *                     → guard (repair on failure) → intent → atomic write
 *                     → hash check → receipt → success → learning → index
 *
 * Files commit concurrently on a pool of {@code ace.commit.jobs} threads; plans
 * touching the same file are committed one after another in priority order.
 * A write failure after the intent leaves an intent without success, which
 * revert treats as never committed.
 */
@Service
public class TransformationPipeline {

    private static final Logger log = LoggerFactory.getLogger(TransformationPipeline.class);

    private final AcePaths          paths;
    private final FileSystemManager fileSystem;
    private final GuardVerifier     guardVerifier;
    private final RepairEngine      repairEngine;
    private final RepairReportStore reportStore;
    private final ReceiptStore      receiptStore;
    private final PolicyEngine      policyEngine;
    private final LearningEngine    learning;
    private final ContentIndex      index;
    private final EventBus          eventBus;
    private final ApplyModeResolver applyMode;
    private final FileLockRegistry  locks;
    private final RunContextFactory runContexts;
    private final Clock             clock;
    private final int               commitJobs;
    private final ChangeBudget      budget;

    public TransformationPipeline(
            AcePaths          paths,
            FileSystemManager fileSystem,
            GuardVerifier     guardVerifier,
            RepairEngine      repairEngine,
            RepairReportStore reportStore,
            ReceiptStore      receiptStore,
            PolicyEngine      policyEngine,
            LearningEngine    learning,
            ContentIndex      index,
            EventBus          eventBus,
            ApplyModeResolver applyMode,
            FileLockRegistry  locks,
            RunContextFactory runContexts,
            Clock             clock,
            @Value("${ace.commit.jobs:2}")        int commitJobs,
            @Value("${ace.budget.max-files:0}")   int maxFiles,
            @Value("${ace.budget.max-lines:0}")   int maxLines
    ) {
        if (commitJobs < 1) {
            throw new InvalidArgsException("ace.commit.jobs must be at least 1, got " + commitJobs);
        }
        this.paths         = paths;
        this.fileSystem    = fileSystem;
        this.guardVerifier = guardVerifier;
        this.repairEngine  = repairEngine;
        this.reportStore   = reportStore;
        this.receiptStore  = receiptStore;
        this.policyEngine  = policyEngine;
        this.learning      = learning;
        this.index         = index;
        this.eventBus      = eventBus;
        this.applyMode     = applyMode;
        this.locks         = locks;
        this.runContexts   = runContexts;
        this.clock         = clock;
        this.commitJobs    = commitJobs;
        this.budget        = new ChangeBudget(maxFiles, maxLines);
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public PipelineResult run(List<EditPlan> plans) {
        return run(plans, false);
    }

    /**
     * Runs {@code plans} through policy, budget and commit.
     *
     * @param dryRun stop after the budget step: nothing is written and nothing is learned
     */
    public PipelineResult run(List<EditPlan> plans, boolean dryRun) {
        Set<String> ids = new HashSet<>();
        for (EditPlan plan : plans) {
            if (!ids.add(plan.getId())) {
                throw new InvalidArgsException("Duplicate plan id: " + plan.getId());
            }
        }

        String runId = RunContext.newRunId(clock);
        log.info("========== ACE RUN {} START ({} plans, mode={}, dryRun={}) ==========",
                runId, plans.size(), applyMode.getMode(), dryRun);

        Map<String, PlanOutcome> outcomes = new HashMap<>();
        List<EditPlan>           approved = new ArrayList<>();
        Map<String, PolicyEvaluation> evaluations = new HashMap<>();

        // ---------------------------------------------------------------------
        // POLICY
        // ---------------------------------------------------------------------
        for (EditPlan plan : plans) {
            PolicyEvaluation evaluation = policyEngine.enforcePolicy(plan);
            evaluations.put(plan.getId(), evaluation);

            if (evaluation.isDeny()) {
                outcomes.put(plan.getId(), PlanOutcome.withoutCommit(evaluation, PlanOutcome.Status.DENIED));
                if (!dryRun) {
                    recordForRules(plan, Outcome.SKIPPED, null);
                    publish(EventType.PLAN_DENIED, plan.getId(), Map.of("reasons", evaluation.getReasons()));
                }
            } else if (evaluation.isSuggest() || applyMode.isSuggestOnly()) {
                outcomes.put(plan.getId(), PlanOutcome.withoutCommit(evaluation, PlanOutcome.Status.SUGGESTED));
                if (!dryRun) {
                    recordForRules(plan, Outcome.SUGGESTED, null);
                    publish(EventType.PLAN_SUGGESTED, plan.getId(), Map.of("score", evaluation.getScore()));
                }
            } else {
                approved.add(plan);
            }
        }

        // ---------------------------------------------------------------------
        // PRIORITY + BUDGET
        // ---------------------------------------------------------------------
        List<EditPlan> ordered = policyEngine.prioritize(approved);
        ChangeBudget.BudgetResult budgeted = budget.apply(ordered);
        for (EditPlan plan : budgeted.getExcluded()) {
            outcomes.put(plan.getId(),
                    PlanOutcome.withoutCommit(evaluations.get(plan.getId()), PlanOutcome.Status.BUDGET_EXCLUDED));
        }

        Path journalPath = null;
        if (dryRun) {
            for (EditPlan plan : budgeted.getSelected()) {
                outcomes.put(plan.getId(),
                        PlanOutcome.withoutCommit(evaluations.get(plan.getId()), PlanOutcome.Status.PLANNED));
            }
        } else if (!budgeted.getSelected().isEmpty()) {
            RunContext context = runContexts.create(runId);
            try {
                Map<String, List<FileCommit>> commits = commitAll(context, budgeted.getSelected(), evaluations);
                for (EditPlan plan : budgeted.getSelected()) {
                    PlanOutcome outcome = PlanOutcome.fromCommits(
                            evaluations.get(plan.getId()), commits.getOrDefault(plan.getId(), List.of()));
                    outcomes.put(plan.getId(), outcome);
                }
            } finally {
                closeQuietly(context);
                saveIndex();
            }
            journalPath = context.getJournalPath().orElse(null);
        }

        List<PlanOutcome> inInputOrder = new ArrayList<>();
        for (EditPlan plan : plans) {
            inInputOrder.add(outcomes.get(plan.getId()));
        }

        PipelineResult result = new PipelineResult(runId, dryRun, inInputOrder, journalPath);
        log.info("========== ACE RUN {} END {} ==========", runId, result.counts());
        return result;
    }

    // =========================================================================
    // COMMIT
    // =========================================================================

    /**
     * Groups the selected plans' edits by file and commits each file on the pool.
     *
     * @return per-plan file results, files in sorted order
     */
    private Map<String, List<FileCommit>> commitAll(RunContext context, List<EditPlan> selected,
                                                    Map<String, PolicyEvaluation> evaluations) {
        Map<String, List<EditPlan>> byFile = new TreeMap<>();
        for (EditPlan plan : selected) {
            for (String file : plan.files()) {
                byFile.computeIfAbsent(file, f -> new ArrayList<>()).add(plan);
            }
        }

        Map<String, Map<String, FileCommit>> results = new ConcurrentHashMap<>();
        if (byFile.isEmpty()) {
            return new HashMap<>();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(commitJobs, byFile.size()), commitThreads());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Map.Entry<String, List<EditPlan>> entry : byFile.entrySet()) {
                futures.add(pool.submit(() ->
                        commitFileSequence(context, entry.getKey(), entry.getValue(), evaluations, results)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new OperationalException("Commit worker failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationalException("Commit interrupted", e);
        } finally {
            pool.shutdownNow();
        }

        Map<String, List<FileCommit>> perPlan = new HashMap<>();
        for (EditPlan plan : selected) {
            Map<String, FileCommit> files = results.getOrDefault(plan.getId(), Map.of());
            perPlan.put(plan.getId(), new ArrayList<>(new TreeMap<>(files).values()));
        }
        return perPlan;
    }

    private void commitFileSequence(RunContext context, String file, List<EditPlan> plans,
                                    Map<String, PolicyEvaluation> evaluations,
                                    Map<String, Map<String, FileCommit>> results) {
        Path target;
        try {
            target = fileSystem.resolveSafePath(file);
        } catch (FileSystemException e) {
            for (EditPlan plan : plans) {
                store(results, plan, FileCommit.error(file, e.getMessage()));
            }
            return;
        }

        ReentrantLock lock = locks.lockFor(target);
        lock.lock();
        try {
            for (EditPlan plan : plans) {
                FileCommit commit = commitFile(context, plan, evaluations.get(plan.getId()), file, target);
                store(results, plan, commit);
                log.info("[Pipeline] {} / {} → {}", plan.getId(), file, commit.getStatus());
            }
        } finally {
            lock.unlock();
        }
    }

    private static void store(Map<String, Map<String, FileCommit>> results, EditPlan plan, FileCommit commit) {
        results.computeIfAbsent(plan.getId(), id -> new ConcurrentHashMap<>()).put(commit.getFile(), commit);
    }

    /**
     * Commits one plan's edits to one file. Caller holds the file's lock.
     */
    FileCommit commitFile(RunContext context, EditPlan plan, PolicyEvaluation evaluation,
                          String file, Path target) {
        long   started = System.nanoTime();
        String key     = paths.relativize(target);
        boolean python = GuardVerifier.isPythonFile(target);

        // ---------------------------------------------------------------------
        // READ + PRE-CHECKS (nothing journaled yet)
        // ---------------------------------------------------------------------
        byte[] originalBytes;
        String original;
        try {
            originalBytes = fileSystem.readBytes(key);
            original      = decodeUtf8(originalBytes);
        } catch (FileSystemException | CharacterCodingException e) {
            return failed(plan, key, "Cannot read original: " + e.getMessage());
        }

        if (python) {
            CheckResult parse = guardVerifier.verifyPythonParse(original);
            if (!parse.isOk()) {
                return failed(plan, key, "Original does not parse: " + String.join("; ", parse.getErrors()));
            }
        }

        List<Edit> edits = plan.editsFor(file);
        TryApplyResult applied;
        try {
            EditApplier.validateNonOverlapping(edits);
            applied = repairEngine.tryApplyWithRepair(Path.of(key), edits, original, guardFor(python), context.getRunId());
        } catch (AceException e) {
            return failed(plan, key, e.getMessage());
        }

        String reportPath = null;
        if (applied.getReport().isPresent()) {
            RepairReport report = applied.getReport().get();
            try {
                reportPath = paths.relativize(reportStore.write(report));
            } catch (IOException e) {
                log.warn("[Pipeline] Could not write repair report for {}: {}", key, e.getMessage());
            }
        }

        if (!applied.isSuccess()) {
            String reason = applied.getReport().map(RepairReport::getGuardFailureReason).orElse("guard failed");
            publish(EventType.PLAN_FAILED, plan.getId(), Map.of("file", key, "reason", reason));
            return FileCommit.rejected(key, reportPath, reason);
        }

        String after = applied.getContent();
        if (ReceiptStore.isIdempotentTransformation(original, after)) {
            return FileCommit.unchanged(key);
        }

        // ---------------------------------------------------------------------
        // INTENT → WRITE → VERIFY → RECEIPT → SUCCESS
        // ---------------------------------------------------------------------
        byte[] afterBytes = after.getBytes(StandardCharsets.UTF_8);
        String beforeSha  = ContentHasher.sha256(originalBytes);
        String expected   = ContentHasher.sha256(afterBytes);
        String contextKey = LearningEngine.contextKey(plan);

        try {
            context.journal().logIntent(key, beforeSha, originalBytes.length, plan.getRuleIds(),
                    plan.getId(), original, contextKey);
        } catch (IOException e) {
            return failed(plan, key, "Journal intent failed, file untouched: " + e.getMessage());
        }

        String actual;
        try {
            fileSystem.atomicWrite(key, afterBytes);
            actual = fileSystem.sha256(key);
        } catch (FileSystemException e) {
            return failed(plan, key, "Write failed: " + e.getMessage());
        }

        if (!actual.equals(expected)) {
            String message = "Hash after write " + ContentHasher.shortHash(actual, 8)
                    + " does not match expected " + ContentHasher.shortHash(expected, 8);
            log.error("[Pipeline] Integrity failure on {}: {}", key, message);
            publish(EventType.INTEGRITY_FAILURE, key, Map.of("plan_id", plan.getId(), "reason", message));
            return FileCommit.error(key, message);
        }

        long durationMs = (System.nanoTime() - started) / 1_000_000;
        Receipt receipt = receiptStore.createReceipt(plan.getId(), key, original, after,
                true, true, plan.getEstimatedRisk(), durationMs,
                PolicyEngine.policyHash(evaluation.getThresholds()));
        String receiptId = ReceiptStore.receiptId(receipt);

        try {
            context.journal().logSuccess(key, actual, afterBytes.length, receiptId, receipt);
        } catch (IOException e) {
            log.error("[Pipeline] {} was written but the success entry failed: {}", key, e.getMessage());
            return FileCommit.error(key, "Written, but journal success failed: " + e.getMessage());
        }

        // ---------------------------------------------------------------------
        // LEARN + INDEX + EVENTS
        // ---------------------------------------------------------------------
        recordForRules(plan, Outcome.APPLIED, key);
        try {
            index.addFile(target);
        } catch (IOException e) {
            log.warn("[Pipeline] Could not refresh index entry for {}: {}", key, e.getMessage());
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("file", key);
        attributes.put("receipt_id", receiptId);
        publish(EventType.PLAN_APPLIED, plan.getId(), attributes);
        if (applied.isPartialApply()) {
            RepairReport report = applied.getReport().get();
            publish(EventType.REPAIR_PARTIAL, plan.getId(), Map.of(
                    "file", key,
                    "safe_edits", report.getSafeEdits(),
                    "failed_edits", report.getFailedEdits()));
        }

        return FileCommit.committed(key, receiptId, reportPath, applied.isPartialApply());
    }

    // =========================================================================
    // INTEGRITY
    // =========================================================================

    /**
     * Checks every journaled receipt against the workspace. Failures are reported
     * and published, never corrected.
     */
    public List<String> verifyIntegrity() {
        List<String> failures = receiptStore.verifyReceipts(paths);
        for (String failure : failures) {
            publish(EventType.INTEGRITY_FAILURE, "receipts", Map.of("reason", failure));
        }
        return failures;
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private EditGuard guardFor(boolean python) {
        if (python) {
            return guardVerifier::guardEdit;
        }
        return (file, before, after) -> GuardResult.pass(file.toString(), before, after, GuardType.NON_PYTHON);
    }

    private FileCommit failed(EditPlan plan, String key, String message) {
        log.warn("[Pipeline] {} / {} skipped: {}", plan.getId(), key, message);
        publish(EventType.PLAN_FAILED, plan.getId(), Map.of("file", key, "reason", message));
        return FileCommit.error(key, message);
    }

    private void recordForRules(EditPlan plan, Outcome outcome, String file) {
        String contextKey = LearningEngine.contextKey(plan);
        for (String rule : plan.getRuleIds()) {
            learning.recordOutcome(rule, outcome, contextKey, file);
        }
    }

    private void publish(EventType type, String subject, Map<String, Object> attributes) {
        eventBus.publish(new Event(type, "pipeline", subject, attributes, clock.instant()));
    }

    private void saveIndex() {
        try {
            index.save();
        } catch (IOException e) {
            log.warn("[Pipeline] Index save failed: {}", e.getMessage());
        }
    }

    private static void closeQuietly(RunContext context) {
        try {
            context.close();
        } catch (IOException e) {
            log.error("[Pipeline] Failed to close journal for {}: {}", context.getRunId(), e.getMessage());
        }
    }

    private static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private static ThreadFactory commitThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ace-commit-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
