package com.aceengine.orchestrator;

import com.aceengine.communication.EventBus;
import com.aceengine.config.AcePaths;
import com.aceengine.core.error.InvalidArgsException;
import com.aceengine.core.error.OperationalException;
import com.aceengine.core.event.Event;
import com.aceengine.core.event.EventType;
import com.aceengine.core.filesystem.AtomicFileWriter;
import com.aceengine.core.filesystem.ContentHasher;
import com.aceengine.core.index.ContentIndex;
import com.aceengine.core.journal.Journal;
import com.aceengine.core.journal.JournalRepository;
import com.aceengine.core.journal.RevertContext;
import com.aceengine.core.learning.LearningEngine;
import com.aceengine.core.learning.Outcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * RevertService — undoes a run from its journal alone.
 *
 * Contexts are undone most-recent-first. A file is restored only when its current
 * hash still equals the hash the run left behind; anything else (edited since,
 * deleted, pre-image not matching its recorded hash) is skipped and reported,
 * never forced. Restores go through the same atomic write as commits and are
 * recorded in a separate {@code revert-<run_id>} journal.
 */
@Service
public class RevertService {

    private static final Logger log = LoggerFactory.getLogger(RevertService.class);

    public static final String REVERT_PREFIX = "revert-";

    private final AcePaths          paths;
    private final JournalRepository journals;
    private final LearningEngine    learning;
    private final ContentIndex      index;
    private final EventBus          eventBus;
    private final FileLockRegistry  locks;
    private final Clock             clock;

    public RevertService(
            AcePaths          paths,
            JournalRepository journals,
            LearningEngine    learning,
            ContentIndex      index,
            EventBus          eventBus,
            FileLockRegistry  locks,
            Clock             clock
    ) {
        this.paths    = paths;
        this.journals = journals;
        this.learning = learning;
        this.index    = index;
        this.eventBus = eventBus;
        this.locks    = locks;
        this.clock    = clock;
    }

    // =========================================================================
    // Entry points
    // =========================================================================

    /**
     * Reverts the most recent run that has not been reverted yet; revert journals
     * themselves are never picked.
     */
    public RevertSummary revertLatest() {
        Optional<Path> latest;
        try {
            latest = journals.listJournals().stream()
                    .filter(p -> !p.getFileName().toString().startsWith(REVERT_PREFIX))
                    .filter(p -> !isReverted(JournalRepository.runIdOf(p)))
                    .max(Comparator.comparing(RevertService::modifiedTime)
                            .thenComparing(p -> p.getFileName().toString()));
        } catch (IOException e) {
            throw new OperationalException("Cannot list journals: " + e.getMessage(), e);
        }
        if (latest.isEmpty()) {
            throw new InvalidArgsException("No unreverted journal in " + journals.getJournalsDir());
        }
        return revert(latest.get());
    }

    public RevertSummary revert(String runId) {
        if (runId == null || runId.isBlank() || runId.contains("/") || runId.contains("\\")) {
            throw new InvalidArgsException("Invalid run id: " + runId);
        }
        Path journal = journals.pathFor(runId);
        if (!Files.exists(journal)) {
            throw new InvalidArgsException("No journal for run " + runId);
        }
        return revert(journal);
    }

    /**
     * @throws InvalidArgsException if the run already has a revert journal
     */
    public RevertSummary revert(Path journalFile) {
        String runId = JournalRepository.runIdOf(journalFile);
        if (isReverted(runId)) {
            throw new InvalidArgsException("Run " + runId + " was already reverted");
        }

        List<RevertContext> plan;
        try {
            plan = journals.buildRevertPlan(journalFile);
        } catch (IOException e) {
            throw new OperationalException("Cannot read journal " + journalFile.getFileName() + ": " + e.getMessage(), e);
        }

        log.info("[RevertService] Reverting {} modification(s) from {}", plan.size(), runId);

        String              revertRunId = REVERT_PREFIX + runId;
        List<String>        reverted    = new ArrayList<>();
        Map<String, String> skipped     = new LinkedHashMap<>();

        if (plan.isEmpty()) {
            return new RevertSummary(runId, revertRunId, reverted, skipped);
        }

        try (Journal revertJournal = journals.open(revertRunId)) {
            for (int i = plan.size() - 1; i >= 0; i--) {
                RevertContext context = plan.get(i);
                String reason = revertOne(context, revertJournal, runId);
                if (reason == null) {
                    reverted.add(context.getFile());
                } else {
                    skipped.put(context.getFile(), reason);
                    log.warn("[RevertService] Skipped {}: {}", context.getFile(), reason);
                }
            }
        } catch (IOException e) {
            throw new OperationalException("Revert journal failed: " + e.getMessage(), e);
        }

        try {
            index.save();
        } catch (IOException e) {
            log.warn("[RevertService] Index save failed: {}", e.getMessage());
        }

        RevertSummary summary = new RevertSummary(runId, revertRunId, reverted, skipped);
        log.info("[RevertService] {}", summary);
        return summary;
    }

    // =========================================================================
    // Single file
    // =========================================================================

    /** @return null on success, otherwise why the file was left alone */
    private String revertOne(RevertContext context, Journal revertJournal, String runId) throws IOException {
        Path target = paths.workspaceRoot().resolve(context.getFile()).normalize();
        if (!target.startsWith(paths.workspaceRoot())) {
            return "Path outside workspace";
        }

        byte[] restore = context.getRestoreContent().getBytes(StandardCharsets.UTF_8);
        if (!ContentHasher.sha256(restore).equals(context.getOriginalSha())) {
            return "Journaled pre-image does not match its recorded hash";
        }

        ReentrantLock lock = locks.lockFor(target);
        lock.lock();
        try {
            if (!Files.isRegularFile(target)) {
                return "File no longer exists";
            }
            String current = ContentHasher.sha256(target);
            if (!current.equals(context.getExpectedCurrentSha())) {
                publish(EventType.INTEGRITY_FAILURE, context.getFile(),
                        Map.of("run_id", runId, "reason", "modified since apply"));
                return "Modified since apply (expected " + ContentHasher.shortHash(context.getExpectedCurrentSha(), 8)
                        + ", found " + ContentHasher.shortHash(current, 8) + ")";
            }

            AtomicFileWriter.write(target, restore);
            String restored = ContentHasher.sha256(target);
            if (!restored.equals(context.getOriginalSha())) {
                publish(EventType.INTEGRITY_FAILURE, context.getFile(),
                        Map.of("run_id", runId, "reason", "restored hash mismatch"));
                return "Restored content hash " + ContentHasher.shortHash(restored, 8) + " does not match original";
            }

            revertJournal.logRevert(context.getFile(), current, restored, "revert of " + runId);
        } finally {
            lock.unlock();
        }

        for (String rule : context.getRuleIds()) {
            learning.recordOutcome(rule, Outcome.REVERTED, context.getContextKey(), context.getFile());
        }
        try {
            index.addFile(target);
        } catch (IOException e) {
            log.warn("[RevertService] Could not refresh index entry for {}: {}", context.getFile(), e.getMessage());
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("run_id", runId);
        attributes.put("plan_id", context.getPlanId() == null ? "" : context.getPlanId());
        publish(EventType.FILE_REVERTED, context.getFile(), attributes);
        return null;
    }

    private void publish(EventType type, String subject, Map<String, Object> attributes) {
        eventBus.publish(new Event(type, "revert", subject, attributes, clock.instant()));
    }

    private boolean isReverted(String runId) {
        return Files.exists(journals.pathFor(REVERT_PREFIX + runId));
    }

    private static FileTime modifiedTime(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
