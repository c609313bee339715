package com.aceengine.core.learning;

import com.aceengine.core.edit.Edit;
import com.aceengine.core.edit.EditPlan;
import com.aceengine.core.edit.Finding;
import com.aceengine.core.edit.Severity;
import com.aceengine.core.filesystem.ContentHasher;
import com.aceengine.core.policy.Thresholds;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LearningEngineTest {

    private static final double EPS = 1e-9;

    @TempDir
    Path tempDir;

    private Path           learnFile;
    private Clock          clock;
    private LearningEngine learning;

    @BeforeEach
    void setUp() {
        learnFile = tempDir.resolve(".ace/learn.json");
        clock     = Clock.fixed(Instant.parse("2025-01-31T12:00:00Z"), ZoneOffset.UTC);
        learning  = new LearningEngine(learnFile, clock);
    }

    private void record(String rule, Outcome outcome, int times) {
        for (int i = 0; i < times; i++) learning.recordOutcome(rule, outcome);
    }

    @Test
    void testUnknownRuleUsesDefaults() {
        Thresholds thresholds = learning.tunedThresholds("never-seen");

        assertEquals(Thresholds.DEFAULT_AUTO, thresholds.getAuto(), EPS);
        assertEquals(Thresholds.DEFAULT_SUGGEST, thresholds.getSuggest(), EPS);
        assertFalse(Files.exists(learnFile));
    }

    @Test
    void testSmallSampleIsNotTuned() {
        record("r", Outcome.APPLIED, 4);

        assertEquals(0.70, learning.tunedThreshold("r"), EPS);
    }

    @Test
    void testHighApplyRateLowersThreshold() {
        record("r", Outcome.APPLIED, 5);

        assertEquals(0.65, learning.tunedThreshold("r"), EPS);
    }

    @Test
    void testHighRevertRateRaisesThreshold() {
        record("r", Outcome.APPLIED, 3);
        record("r", Outcome.REVERTED, 2);

        assertEquals(0.75, learning.tunedThreshold("r"), EPS);
        assertEquals(0.50, learning.tunedThresholds("r").getSuggest(), EPS);
    }

    @Test
    void testSuggestionsAndSkipsDoNotCountAsSample() {
        record("r", Outcome.SUGGESTED, 10);
        record("r", Outcome.SKIPPED, 10);

        RuleStats stats = learning.getRuleStats("r").orElseThrow();
        assertEquals(0, stats.getTotalActions());
        assertEquals(10, stats.getSuggested());
        assertEquals(10, stats.getSkipped());
        assertEquals(0.70, learning.tunedThreshold("r"), EPS);
    }

    @Test
    void testThresholdIsClampedToBounds() throws Exception {
        Files.createDirectories(learnFile.getParent());
        Files.writeString(learnFile, """
                {"rules": {}, "contexts": {}, "tuning": {"min_auto": 0.95, "min_suggest": 0.4}}
                """);
        LearningEngine tuned = new LearningEngine(learnFile, clock);

        assertEquals(LearningEngine.CEIL_MIN_AUTO, tuned.tunedThreshold("any"), EPS);
        assertEquals(0.4, tuned.tunedThresholds("any").getSuggest(), EPS);
    }

    @Test
    void testLongRevertHistoryNeverExceedsCeiling() throws Exception {
        for (double minAuto : new double[] {0.70, 0.85, 0.95}) {
            LearningEngine tuned = engineWithMinAuto(minAuto);
            for (int i = 0; i < 10; i++) tuned.recordOutcome("risky", Outcome.APPLIED);
            for (int i = 0; i < 50; i++) tuned.recordOutcome("risky", Outcome.REVERTED);

            double expected = Math.min(LearningEngine.CEIL_MIN_AUTO, minAuto + LearningEngine.DELTA);
            assertEquals(expected, tuned.tunedThreshold("risky"), EPS, "min_auto " + minAuto);
            assertTrue(tuned.tunedThreshold("risky") <= LearningEngine.CEIL_MIN_AUTO);
        }
    }

    @Test
    void testLongApplyHistoryNeverDropsBelowFloor() throws Exception {
        for (double minAuto : new double[] {0.70, 0.60, 0.40}) {
            LearningEngine tuned = engineWithMinAuto(minAuto);
            for (int i = 0; i < 50; i++) tuned.recordOutcome("steady", Outcome.APPLIED);

            double expected = Math.max(LearningEngine.FLOOR_MIN_AUTO, minAuto - LearningEngine.DELTA);
            assertEquals(expected, tuned.tunedThreshold("steady"), EPS, "min_auto " + minAuto);
            assertTrue(tuned.tunedThreshold("steady") >= LearningEngine.FLOOR_MIN_AUTO);
        }
    }

    private LearningEngine engineWithMinAuto(double minAuto) throws Exception {
        Path file = tempDir.resolve("learn-" + minAuto + ".json");
        Files.writeString(file, "{\"rules\": {}, \"contexts\": {}, \"tuning\": {\"min_auto\": " + minAuto + "}}\n");
        return new LearningEngine(file, clock);
    }

    @Test
    void testConsecutiveRevertsSkipRuleForFile() {
        for (int i = 0; i < 2; i++) learning.recordOutcome("r", Outcome.REVERTED, null, "a.py");
        assertFalse(learning.shouldSkipFileForRule("r", "a.py"));

        learning.recordOutcome("r", Outcome.REVERTED, null, "a.py");

        assertTrue(learning.shouldSkipFileForRule("r", "a.py"));
        assertFalse(learning.shouldSkipFileForRule("r", "b.py"));
        assertFalse(learning.shouldSkipFileForRule("other", "a.py"));
    }

    @Test
    void testApplyOnFileEndsRevertStreak() {
        for (int i = 0; i < 3; i++) learning.recordOutcome("r", Outcome.REVERTED, null, "a.py");
        learning.recordOutcome("r", Outcome.SKIPPED);
        assertTrue(learning.shouldSkipFileForRule("r", "a.py"));

        learning.recordOutcome("r", Outcome.APPLIED, null, "a.py");

        assertFalse(learning.shouldSkipFileForRule("r", "a.py"));
        assertEquals(0, learning.getRuleStats("r").orElseThrow().consecutiveRevertsFor("a.py"));
    }

    @Test
    void testContextSkipNeedsEnoughHits() {
        learning.recordOutcome("r", Outcome.REVERTED, "ctx", null);
        learning.recordOutcome("r", Outcome.REVERTED, "ctx", null);
        assertFalse(learning.shouldSkipContext("ctx", 0.5));

        learning.recordOutcome("r", Outcome.APPLIED, "ctx", null);

        assertTrue(learning.shouldSkipContext("ctx", 0.5));
        assertFalse(learning.shouldSkipContext("ctx", 0.7));
        assertFalse(learning.shouldSkipContext("unknown", 0.0));
        ContextStats stats = learning.getContextStats("ctx").orElseThrow();
        assertEquals(3, stats.getHits());
        assertEquals(2, stats.getReverts());
    }

    @Test
    void testOutcomesPersistAcrossInstances() throws Exception {
        learning.recordOutcome("r", Outcome.APPLIED, "ctx", "a.py");
        learning.recordOutcome("r", Outcome.REVERTED, "ctx", "a.py");

        LearningEngine reloaded = new LearningEngine(learnFile, clock);
        RuleStats stats = reloaded.getRuleStats("r").orElseThrow();

        assertEquals(1, stats.getApplied());
        assertEquals(1, stats.getReverted());
        assertEquals(1, stats.consecutiveRevertsFor("a.py"));
        assertEquals(clock.millis() / 1000.0, stats.getLastUpdated(), EPS);
        assertEquals(2, reloaded.getContextStats("ctx").orElseThrow().getHits());

        String json = Files.readString(learnFile);
        assertTrue(json.contains("\"consecutive_reverts\""));
        assertTrue(json.contains("\"min_auto\" : 0.7"));
    }

    @Test
    void testCorruptFileStartsFresh() throws Exception {
        Files.createDirectories(learnFile.getParent());
        Files.writeString(learnFile, "{{{ definitely not json");

        LearningEngine recovered = new LearningEngine(learnFile, clock);

        assertTrue(recovered.getRuleStats("r").isEmpty());
        recovered.recordOutcome("r", Outcome.APPLIED);
        assertEquals(1, new LearningEngine(learnFile, clock).getRuleStats("r").orElseThrow().getApplied());
    }

    @Test
    void testResetDeletesFile() {
        learning.recordOutcome("r", Outcome.APPLIED);
        assertTrue(Files.exists(learnFile));

        learning.reset();

        assertFalse(Files.exists(learnFile));
        assertTrue(learning.getRuleStats("r").isEmpty());
    }

    @Test
    void testContextKey() {
        Finding finding = new Finding("pkg/a.py", 3, "no-bare-except", Severity.HIGH, "bare except", "x".repeat(150));
        EditPlan plan = new EditPlan("plan-1", List.of(Edit.replace("pkg/a.py", 3, 3, "y")),
                List.of(finding), List.of(), 0.1);
        EditPlan samePlanOtherId = new EditPlan("plan-2", plan.getEdits(), plan.getFindings(), List.of(), 0.1);

        String expectedHash = ContentHasher.sha256("x".repeat(100)).substring(0, 8);
        assertEquals("pkg/a.py:no-bare-except:" + expectedHash, LearningEngine.contextKey(plan));
        assertEquals(LearningEngine.contextKey(plan), LearningEngine.contextKey(samePlanOtherId));

        EditPlan noFindings = new EditPlan("plan-3", List.of(), List.of(), List.of(), 0.0);
        assertEquals(LearningEngine.NO_FINDINGS_CONTEXT, LearningEngine.contextKey(noFindings));
    }

    @Test
    void testInsightsOrdering() {
        record("eager", Outcome.APPLIED, 6);
        record("risky", Outcome.APPLIED, 3);
        record("risky", Outcome.REVERTED, 3);
        record("steady", Outcome.APPLIED, 4);
        record("steady", Outcome.REVERTED, 1);
        record("tiny", Outcome.REVERTED, 1);

        List<RuleInsight> tuned = learning.getTunedRules();
        assertEquals(List.of("risky", "eager"), tuned.stream().map(RuleInsight::getRuleId).collect(Collectors.toList()));
        assertEquals(0.75, tuned.get(0).getTunedThreshold(), EPS);
        assertEquals(0.65, tuned.get(1).getTunedThreshold(), EPS);

        List<RuleInsight> reverted = learning.getTopRulesByRevertRate(2);
        assertEquals(List.of("risky", "steady"), reverted.stream().map(RuleInsight::getRuleId).collect(Collectors.toList()));
        assertEquals(0.5, reverted.get(0).getRevertRate(), EPS);
    }
}
