package com.aceengine.orchestrator;

import com.aceengine.core.edit.Edit;
import com.aceengine.core.edit.EditPlan;
import com.aceengine.core.edit.Severity;
import com.aceengine.core.error.InvalidArgsException;
import com.aceengine.core.event.EventType;
import com.aceengine.core.journal.IntentEntry;
import com.aceengine.core.journal.JournalEntry;
import com.aceengine.core.journal.SuccessEntry;
import com.aceengine.core.learning.RuleStats;
import com.aceengine.core.receipt.Receipt;
import com.aceengine.core.receipt.ReceiptStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.aceengine.orchestrator.PipelineHarness.plan;
import static org.junit.jupiter.api.Assertions.*;

class TransformationPipelineTest {

    private static final String MODULE = """
            def add(a, b):
                return a + b

            def sub(a, b):
                return a - b
            """;

    @TempDir
    Path tempDir;

    private PipelineHarness harness;

    @BeforeEach
    void setUp() throws Exception {
        harness = new PipelineHarness(tempDir);
        Files.writeString(tempDir.resolve("calc.py"), MODULE);
    }

    private String read(String file) throws Exception {
        return Files.readString(tempDir.resolve(file));
    }

    // ================================================================
    // Commit path
    // ================================================================

    @Test
    void testAppliesApprovedPlan() throws Exception {
        EditPlan p = plan("p1", "rename", Severity.CRITICAL, Edit.replace("calc.py", 2, 2, "    return b + a"));

        PipelineResult result = harness.pipeline.run(List.of(p));

        assertEquals(PlanOutcome.Status.APPLIED, result.outcomeFor("p1").orElseThrow().getStatus());
        assertTrue(read("calc.py").contains("return b + a"));
        assertTrue(result.getJournalPath().isPresent());

        List<JournalEntry> entries = harness.journals.readJournal(result.getJournalPath().get());
        assertEquals(2, entries.size());
        IntentEntry intent = assertInstanceOf(IntentEntry.class, entries.get(0));
        assertEquals("calc.py", intent.getFile());
        assertEquals(MODULE, intent.getPreImage());
        Receipt receipt = assertInstanceOf(SuccessEntry.class, entries.get(1)).receipt().orElseThrow();
        assertTrue(ReceiptStore.verifyReceipt(receipt, read("calc.py")));
        assertFalse(receipt.getPolicyHash().isEmpty());

        RuleStats stats = harness.learning.getRuleStats("rename").orElseThrow();
        assertEquals(1, stats.getApplied());
        assertTrue(harness.eventTypes().contains(EventType.PLAN_APPLIED));
        assertFalse(harness.index.hasChanged(tempDir.resolve("calc.py")));
        assertTrue(harness.pipeline.verifyIntegrity().isEmpty());
    }

    @Test
    void testPartialRepairCommitsSafeEdits() throws Exception {
        EditPlan p = plan("p1", "rewrite", Severity.CRITICAL,
                Edit.replace("calc.py", 2, 2, "    return a + b + 0"),
                Edit.replace("calc.py", 5, 5, "    return (a - b"));

        PipelineResult result = harness.pipeline.run(List.of(p));

        PlanOutcome outcome = result.outcomeFor("p1").orElseThrow();
        assertEquals(PlanOutcome.Status.PARTIAL, outcome.getStatus());
        FileCommit commit = outcome.getFiles().get(0);
        assertEquals(FileCommit.Status.PARTIAL, commit.getStatus());
        assertNotNull(commit.getRepairReport());
        assertTrue(Files.exists(tempDir.resolve(commit.getRepairReport())));

        String content = read("calc.py");
        assertTrue(content.contains("return a + b + 0"));
        assertTrue(content.contains("return a - b\n"));
        assertEquals(1, harness.count(EventType.REPAIR_PARTIAL));
    }

    @Test
    void testRejectedPlanLeavesFileAndJournalUntouched() throws Exception {
        EditPlan p = plan("p1", "bad", Severity.CRITICAL, Edit.replace("calc.py", 1, 1, "def add(a, b)"));

        PipelineResult result = harness.pipeline.run(List.of(p));

        PlanOutcome outcome = result.outcomeFor("p1").orElseThrow();
        assertEquals(PlanOutcome.Status.FAILED, outcome.getStatus());
        assertEquals(FileCommit.Status.REJECTED, outcome.getFiles().get(0).getStatus());
        assertEquals(MODULE, read("calc.py"));
        assertTrue(result.getJournalPath().isEmpty());
        assertTrue(harness.learning.getRuleStats("bad").isEmpty());
        assertEquals(1, harness.count(EventType.PLAN_FAILED));
    }

    @Test
    void testOriginalThatDoesNotParseIsSkipped() throws Exception {
        Files.writeString(tempDir.resolve("broken.py"), "def broken(:\n    pass\n");
        EditPlan p = plan("p1", "r", Severity.CRITICAL, Edit.replace("broken.py", 2, 2, "    return 1"));

        PlanOutcome outcome = harness.pipeline.run(List.of(p)).outcomeFor("p1").orElseThrow();

        assertEquals(PlanOutcome.Status.FAILED, outcome.getStatus());
        assertTrue(outcome.getFiles().get(0).getMessage().startsWith("Original does not parse"));
        assertEquals("def broken(:\n    pass\n", read("broken.py"));
    }

    @Test
    void testOverlappingEditsAreRefused() throws Exception {
        EditPlan p = plan("p1", "r", Severity.CRITICAL,
                Edit.replace("calc.py", 1, 2, "def add(a, b):\n    return 0"),
                Edit.replace("calc.py", 2, 2, "    return 1"));

        PlanOutcome outcome = harness.pipeline.run(List.of(p)).outcomeFor("p1").orElseThrow();

        assertEquals(PlanOutcome.Status.FAILED, outcome.getStatus());
        assertTrue(outcome.getFiles().get(0).getMessage().contains("Overlapping edits"));
        assertEquals(MODULE, read("calc.py"));
    }

    @Test
    void testIdempotentPlanIsUnchanged() throws Exception {
        EditPlan p = plan("p1", "r", Severity.CRITICAL, Edit.replace("calc.py", 2, 2, "    return a + b"));

        PipelineResult result = harness.pipeline.run(List.of(p));

        assertEquals(PlanOutcome.Status.UNCHANGED, result.outcomeFor("p1").orElseThrow().getStatus());
        assertTrue(result.getJournalPath().isEmpty());
    }

    @Test
    void testNonPythonFilesBypassPythonGuard() throws Exception {
        Files.writeString(tempDir.resolve("notes.txt"), "alpha\nbeta\n");
        EditPlan p = plan("p1", "r", Severity.CRITICAL, Edit.replace("notes.txt", 2, 2, "def (((("));

        PipelineResult result = harness.pipeline.run(List.of(p));

        assertEquals(PlanOutcome.Status.APPLIED, result.outcomeFor("p1").orElseThrow().getStatus());
        assertEquals("alpha\ndef ((((\n", read("notes.txt"));
    }

    @Test
    void testNonUtf8FileIsRefused() throws Exception {
        Files.write(tempDir.resolve("latin.txt"), new byte[]{'a', (byte) 0xE9, '\n'});
        EditPlan p = plan("p1", "r", Severity.CRITICAL, Edit.replace("latin.txt", 1, 1, "b"));

        PlanOutcome outcome = harness.pipeline.run(List.of(p)).outcomeFor("p1").orElseThrow();

        assertEquals(PlanOutcome.Status.FAILED, outcome.getStatus());
        assertArrayEquals(new byte[]{'a', (byte) 0xE9, '\n'}, Files.readAllBytes(tempDir.resolve("latin.txt")));
    }

    @Test
    void testPlansOnSameFileApplyInSequence() throws Exception {
        EditPlan first  = plan("a-first", "r1", Severity.CRITICAL, Edit.replace("calc.py", 2, 2, "    return a + b  # one"));
        EditPlan second = plan("b-second", "r2", Severity.CRITICAL, Edit.replace("calc.py", 5, 5, "    return a - b  # two"));

        PipelineResult result = harness.pipeline.run(List.of(second, first));

        assertEquals(2, result.count(PlanOutcome.Status.APPLIED));
        String content = read("calc.py");
        assertTrue(content.contains("# one"));
        assertTrue(content.contains("# two"));
        assertEquals("b-second", result.getOutcomes().get(0).getPlanId());
        assertEquals(1, harness.pipeline.verifyIntegrity().size());
    }

    @Test
    void testManyFilesCommitConcurrently() throws Exception {
        PipelineHarness wide = new PipelineHarness(tempDir, "auto", 4, 0, 0);
        List<EditPlan> plans = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String name = "m" + i + ".py";
            Files.writeString(tempDir.resolve(name), "value = " + i + "\n");
            plans.add(plan("p" + i, "bump", Severity.CRITICAL, Edit.replace(name, 1, 1, "value = " + (i + 100))));
        }

        PipelineResult result = wide.pipeline.run(plans);

        assertEquals(12, result.count(PlanOutcome.Status.APPLIED));
        for (int i = 0; i < 12; i++) {
            assertEquals("value = " + (i + 100) + "\n", read("m" + i + ".py"));
        }
        assertEquals(12, wide.learning.getRuleStats("bump").orElseThrow().getApplied());
        assertEquals(12, wide.journals.readJournal(result.getJournalPath().orElseThrow()).size() / 2);
    }

    // ================================================================
    // Policy, budget, modes
    // ================================================================

    @Test
    void testSuggestAndDenyAreNeverWritten() throws Exception {
        EditPlan suggested = plan("s", "style", Severity.HIGH, Edit.replace("calc.py", 2, 2, "    return b + a"));
        EditPlan denied    = plan("d", "nit", Severity.LOW, Edit.replace("calc.py", 5, 5, "    return -b + a"));

        PipelineResult result = harness.pipeline.run(List.of(suggested, denied));

        assertEquals(PlanOutcome.Status.SUGGESTED, result.outcomeFor("s").orElseThrow().getStatus());
        assertEquals(PlanOutcome.Status.DENIED, result.outcomeFor("d").orElseThrow().getStatus());
        assertEquals(MODULE, read("calc.py"));
        assertEquals(1, harness.learning.getRuleStats("style").orElseThrow().getSuggested());
        assertEquals(1, harness.learning.getRuleStats("nit").orElseThrow().getSkipped());
        assertEquals(List.of(EventType.PLAN_SUGGESTED, EventType.PLAN_DENIED), harness.eventTypes());
    }

    @Test
    void testSuggestOnlyModeNeverWrites() throws Exception {
        PipelineHarness suggestOnly = new PipelineHarness(tempDir, "suggest", 2, 0, 0);
        EditPlan p = plan("p1", "r", Severity.CRITICAL, Edit.replace("calc.py", 2, 2, "    return b + a"));

        PipelineResult result = suggestOnly.pipeline.run(List.of(p));

        assertEquals(PlanOutcome.Status.SUGGESTED, result.outcomeFor("p1").orElseThrow().getStatus());
        assertEquals(MODULE, read("calc.py"));
    }

    @Test
    void testDryRunWritesAndLearnsNothing() throws Exception {
        EditPlan p = plan("p1", "r", Severity.CRITICAL, Edit.replace("calc.py", 2, 2, "    return b + a"));
        EditPlan d = plan("p2", "r", Severity.LOW, Edit.replace("calc.py", 5, 5, "    return b - a"));

        PipelineResult result = harness.pipeline.run(List.of(p, d), true);

        assertTrue(result.isDryRun());
        assertEquals(PlanOutcome.Status.PLANNED, result.outcomeFor("p1").orElseThrow().getStatus());
        assertEquals(PlanOutcome.Status.DENIED, result.outcomeFor("p2").orElseThrow().getStatus());
        assertEquals(MODULE, read("calc.py"));
        assertFalse(Files.exists(harness.paths.learnFile()));
        assertFalse(Files.exists(harness.paths.journalsDir()));
        assertTrue(harness.events.isEmpty());
    }

    @Test
    void testBudgetExcludesLowerPriorityPlans() throws Exception {
        PipelineHarness budgeted = new PipelineHarness(tempDir, "auto", 2, 1, 0);
        Files.writeString(tempDir.resolve("other.py"), "x = 1\n");
        EditPlan big   = plan("big", "r", Severity.CRITICAL,
                Edit.replace("calc.py", 2, 2, "    return b + a"),
                Edit.replace("calc.py", 5, 5, "    return -b + a"));
        EditPlan small = plan("small", "r", Severity.CRITICAL, Edit.replace("other.py", 1, 1, "x = 2"));

        PipelineResult result = budgeted.pipeline.run(List.of(small, big));

        assertEquals(PlanOutcome.Status.APPLIED, result.outcomeFor("big").orElseThrow().getStatus());
        assertEquals(PlanOutcome.Status.BUDGET_EXCLUDED, result.outcomeFor("small").orElseThrow().getStatus());
        assertEquals("x = 1\n", read("other.py"));
    }

    @Test
    void testDuplicatePlanIdsAreRejected() {
        EditPlan a = plan("same", "r", Severity.CRITICAL, Edit.replace("calc.py", 2, 2, "    return b + a"));
        EditPlan b = plan("same", "r", Severity.CRITICAL, Edit.replace("calc.py", 5, 5, "    return b - a"));

        assertThrows(InvalidArgsException.class, () -> harness.pipeline.run(List.of(a, b)));
    }

    @Test
    void testPathOutsideWorkspaceIsRefused() throws Exception {
        EditPlan p = plan("p1", "r", Severity.CRITICAL, Edit.replace("../escape.py", 1, 1, "x = 1"));

        PlanOutcome outcome = harness.pipeline.run(List.of(p)).outcomeFor("p1").orElseThrow();

        assertEquals(PlanOutcome.Status.FAILED, outcome.getStatus());
        assertEquals(FileCommit.Status.ERROR, outcome.getFiles().get(0).getStatus());
    }

    // ================================================================
    // Integrity
    // ================================================================

    @Test
    void testTamperingIsReportedNotCorrected() throws Exception {
        EditPlan p = plan("p1", "r", Severity.CRITICAL, Edit.replace("calc.py", 2, 2, "    return b + a"));
        harness.pipeline.run(List.of(p));

        Files.writeString(tempDir.resolve("calc.py"), "tampered = True\n");
        List<String> failures = harness.pipeline.verifyIntegrity();

        assertEquals(1, failures.size());
        assertTrue(failures.get(0).contains("Hash mismatch for calc.py"));
        assertEquals("tampered = True\n", read("calc.py"));
        assertEquals(1, harness.count(EventType.INTEGRITY_FAILURE));
    }
}
