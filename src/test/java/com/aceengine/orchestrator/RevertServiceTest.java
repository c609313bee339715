package com.aceengine.orchestrator;

import com.aceengine.core.edit.Edit;
import com.aceengine.core.edit.EditPlan;
import com.aceengine.core.edit.Severity;
import com.aceengine.core.error.InvalidArgsException;
import com.aceengine.core.event.EventType;
import com.aceengine.core.journal.JournalEntry;
import com.aceengine.core.journal.RevertEntry;
import com.aceengine.core.learning.LearningEngine;
import com.aceengine.core.learning.Outcome;
import com.aceengine.core.learning.RuleStats;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static com.aceengine.orchestrator.PipelineHarness.plan;
import static org.junit.jupiter.api.Assertions.*;

class RevertServiceTest {

    private static final String A = "a = 1\nb = 2\n";
    private static final String B = "def f():\n    return 1\n";

    @TempDir
    Path tempDir;

    private PipelineHarness harness;

    @BeforeEach
    void setUp() throws Exception {
        harness = new PipelineHarness(tempDir);
        Files.writeString(tempDir.resolve("a.py"), A);
        Files.writeString(tempDir.resolve("b.py"), B);
    }

    private String read(String file) throws Exception {
        return Files.readString(tempDir.resolve(file));
    }

    private PipelineResult applyBoth() {
        EditPlan pa = plan("pa", "rule-a", Severity.CRITICAL, Edit.replace("a.py", 1, 1, "a = 10"));
        EditPlan pb = plan("pb", "rule-b", Severity.CRITICAL, Edit.replace("b.py", 2, 2, "    return 10"));
        PipelineResult result = harness.pipeline.run(List.of(pa, pb));
        assertEquals(2, result.count(PlanOutcome.Status.APPLIED));
        return result;
    }

    @Test
    void testRevertRestoresExactBytes() throws Exception {
        PipelineResult result = applyBoth();

        RevertSummary summary = harness.revertService.revert(result.getRunId());

        assertTrue(summary.isComplete());
        assertEquals(2, summary.getReverted().size());
        assertEquals(A, read("a.py"));
        assertEquals(B, read("b.py"));
        assertEquals(RevertService.REVERT_PREFIX + result.getRunId(), summary.getRevertRunId());
        assertEquals(2, harness.count(EventType.FILE_REVERTED));
    }

    @Test
    void testRevertIsJournaledAndLearned() throws Exception {
        PipelineResult result = applyBoth();

        RevertSummary summary = harness.revertService.revert(result.getRunId());

        List<JournalEntry> entries = harness.journals.readJournal(harness.journals.pathFor(summary.getRevertRunId()));
        assertEquals(2, entries.size());
        RevertEntry entry = assertInstanceOf(RevertEntry.class, entries.get(0));
        assertEquals("revert of " + result.getRunId(), entry.getReason());

        RuleStats stats = harness.learning.getRuleStats("rule-a").orElseThrow();
        assertEquals(1, stats.getApplied());
        assertEquals(1, stats.getReverted());
        assertEquals(1, stats.consecutiveRevertsFor("a.py"));
        assertFalse(harness.index.hasChanged(tempDir.resolve("a.py")));
    }

    @Test
    void testRevertUndoesMostRecentFirst() throws Exception {
        EditPlan first  = plan("p1", "r1", Severity.CRITICAL, Edit.replace("a.py", 1, 1, "a = 10"));
        EditPlan second = plan("p2", "r2", Severity.CRITICAL, Edit.replace("a.py", 2, 2, "b = 20"));
        PipelineResult result = harness.pipeline.run(List.of(first, second));
        assertEquals("a = 10\nb = 20\n", read("a.py"));

        RevertSummary summary = harness.revertService.revert(result.getRunId());

        assertTrue(summary.isComplete(), summary.getSkipped().toString());
        assertEquals(A, read("a.py"));
    }

    @Test
    void testModifiedFileIsSkippedAndReported() throws Exception {
        PipelineResult result = applyBoth();
        Files.writeString(tempDir.resolve("a.py"), "edited by hand\n");

        RevertSummary summary = harness.revertService.revert(result.getRunId());

        assertFalse(summary.isComplete());
        assertTrue(summary.getSkipped().get("a.py").startsWith("Modified since apply"));
        assertEquals(List.of("b.py"), summary.getReverted());
        assertEquals("edited by hand\n", read("a.py"));
        assertEquals(B, read("b.py"));
        assertEquals(1, harness.count(EventType.INTEGRITY_FAILURE));
    }

    @Test
    void testDeletedFileIsSkipped() throws Exception {
        PipelineResult result = applyBoth();
        Files.delete(tempDir.resolve("b.py"));

        RevertSummary summary = harness.revertService.revert(result.getRunId());

        assertEquals("File no longer exists", summary.getSkipped().get("b.py"));
        assertFalse(Files.exists(tempDir.resolve("b.py")));
    }

    @Test
    void testRevertLatestIgnoresRevertJournals() throws Exception {
        PipelineResult first = applyBoth();
        harness.revertService.revert(first.getRunId());
        Files.setLastModifiedTime(harness.journals.pathFor(first.getRunId()), FileTime.fromMillis(1_000));
        Files.setLastModifiedTime(harness.journals.pathFor(RevertService.REVERT_PREFIX + first.getRunId()),
                FileTime.fromMillis(5_000));

        PipelineResult second = harness.pipeline.run(List.of(
                plan("pc", "rule-c", Severity.CRITICAL, Edit.replace("a.py", 2, 2, "b = 3"))));
        Files.setLastModifiedTime(harness.journals.pathFor(second.getRunId()), FileTime.fromMillis(3_000));

        RevertSummary summary = harness.revertService.revertLatest();

        assertEquals(second.getRunId(), summary.getRunId());
        assertEquals(A, read("a.py"));
    }

    @Test
    void testRevertingTheSameRunTwiceIsRejected() throws Exception {
        PipelineResult result = applyBoth();
        assertTrue(harness.revertService.revert(result.getRunId()).isComplete());
        Path revertJournal = harness.journals.pathFor(RevertService.REVERT_PREFIX + result.getRunId());
        List<String> journalLines = Files.readAllLines(revertJournal);

        InvalidArgsException e = assertThrows(InvalidArgsException.class,
                () -> harness.revertService.revert(result.getRunId()));

        assertTrue(e.getMessage().contains("already reverted"));
        assertEquals(journalLines, Files.readAllLines(revertJournal));
        assertEquals(A, read("a.py"));
        assertEquals(B, read("b.py"));
        assertEquals(0, harness.count(EventType.INTEGRITY_FAILURE));
    }

    @Test
    void testRevertLatestWalksBackThroughUnrevertedRuns() throws Exception {
        PipelineResult first = applyBoth();
        Files.setLastModifiedTime(harness.journals.pathFor(first.getRunId()), FileTime.fromMillis(1_000));
        PipelineResult second = harness.pipeline.run(List.of(
                plan("pc", "rule-c", Severity.CRITICAL, Edit.replace("a.py", 2, 2, "b = 3"))));
        Files.setLastModifiedTime(harness.journals.pathFor(second.getRunId()), FileTime.fromMillis(3_000));

        assertEquals(second.getRunId(), harness.revertService.revertLatest().getRunId());
        assertEquals("a = 10\nb = 2\n", read("a.py"));

        assertEquals(first.getRunId(), harness.revertService.revertLatest().getRunId());
        assertEquals(A, read("a.py"));
        assertEquals(B, read("b.py"));

        assertThrows(InvalidArgsException.class, () -> harness.revertService.revertLatest());
        assertEquals(0, harness.count(EventType.INTEGRITY_FAILURE));
    }

    @Test
    void testRepeatedRevertsRaiseTheRuleThreshold() throws Exception {
        for (int i = 0; i < 3; i++) {
            PipelineResult result = harness.pipeline.run(List.of(
                    plan("p" + i, "flaky", Severity.CRITICAL, Edit.replace("a.py", 1, 1, "a = 99"))));
            assertEquals(PlanOutcome.Status.APPLIED, result.outcomeFor("p" + i).orElseThrow().getStatus());
            assertTrue(harness.revertService.revert(result.getRunId()).isComplete());
        }

        assertEquals(0.75, harness.learning.tunedThreshold("flaky"), 1e-9);
        PipelineResult next = harness.pipeline.run(List.of(
                plan("p-next", "flaky", Severity.CRITICAL, Edit.replace("a.py", 1, 1, "a = 99"))));

        assertEquals(PlanOutcome.Status.SUGGESTED, next.outcomeFor("p-next").orElseThrow().getStatus());
        assertEquals(A, read("a.py"));
    }

    @Test
    void testRevertStreakSkipListsTheFile() throws Exception {
        for (int i = 0; i < LearningEngine.REVERT_THRESHOLD_SKIPLIST; i++) {
            harness.learning.recordOutcome("streaky", Outcome.REVERTED, null, "a.py");
        }

        PipelineResult result = harness.pipeline.run(List.of(
                plan("p1", "streaky", Severity.CRITICAL, Edit.replace("a.py", 1, 1, "a = 99")),
                plan("p2", "streaky", Severity.CRITICAL, Edit.replace("b.py", 2, 2, "    return 2"))));

        assertEquals(PlanOutcome.Status.DENIED, result.outcomeFor("p1").orElseThrow().getStatus());
        assertEquals(PlanOutcome.Status.APPLIED, result.outcomeFor("p2").orElseThrow().getStatus());
        assertEquals(A, read("a.py"));
    }

    @Test
    void testUnknownOrInvalidRunId() {
        assertThrows(InvalidArgsException.class, () -> harness.revertService.revert("run-missing"));
        assertThrows(InvalidArgsException.class, () -> harness.revertService.revert("../etc"));
        assertThrows(InvalidArgsException.class, () -> harness.revertService.revertLatest());
    }
}
