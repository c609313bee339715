package com.aceengine.core.learning;

import com.aceengine.config.AcePaths;
import com.aceengine.config.JsonMappers;
import com.aceengine.core.edit.EditPlan;
import com.aceengine.core.edit.Finding;
import com.aceengine.core.error.OperationalException;
import com.aceengine.core.filesystem.AtomicFileWriter;
import com.aceengine.core.filesystem.ContentHasher;
import com.aceengine.core.policy.Thresholds;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * LearningEngine — turns apply/revert/suggest outcomes into per-rule thresholds.
 *
 * State lives in .ace/learn.json and is loaded on first use. Every recorded
 * outcome is saved immediately (write-temp-then-rename). A missing or corrupted
 * file loads as empty data; it never blocks a run.
 *
 * Threshold tuning for a rule with at least {@value #MIN_SAMPLE} applied+reverted
 * outcomes:
 *   revert rate  > 25%  → auto threshold + 0.05 (more conservative)
 *   apply rate   > 80%  → auto threshold - 0.05
 * and the result is always clamped to [0.60, 0.85]. The suggest threshold is
 * never tuned.
 */
@Component
public class LearningEngine {

    private static final Logger log = LoggerFactory.getLogger(LearningEngine.class);

    public static final double FLOOR_MIN_AUTO = 0.60;
    public static final double CEIL_MIN_AUTO  = 0.85;
    public static final double DELTA          = 0.05;

    static final double HIGH_REVERT_RATE = 0.25;
    static final double HIGH_APPLY_RATE  = 0.80;
    static final int    MIN_SAMPLE       = 5;

    /** Consecutive reverts of a rule on one file before that pair is auto-skipped. */
    public static final int REVERT_THRESHOLD_SKIPLIST = 3;

    /** Hits a context needs before its revert rate is trusted. */
    static final int MIN_CONTEXT_HITS = 3;

    public static final String NO_FINDINGS_CONTEXT = "no-findings";

    private static final int SNIPPET_PREFIX_LENGTH = 100;
    private static final int SNIPPET_HASH_LENGTH   = 8;

    private final Path         learnFile;
    private final Clock        clock;
    private final ObjectMapper mapper;

    private LearningData data;

    @Autowired
    public LearningEngine(AcePaths paths, Clock clock) {
        this(paths.learnFile(), clock);
    }

    public LearningEngine(Path learnFile, Clock clock) {
        this.learnFile = learnFile;
        this.clock     = clock;
        this.mapper    = JsonMappers.sorted();
    }

    // ================================================================
    // Persistence
    // ================================================================

    private LearningData data() {
        if (data == null) {
            data = load();
        }
        return data;
    }

    private LearningData load() {
        if (!Files.exists(learnFile)) {
            return new LearningData();
        }
        try {
            LearningData loaded = mapper.readValue(learnFile.toFile(), LearningData.class);
            if (loaded == null) {
                throw new IOException("empty document");
            }
            loaded.normalize();
            log.info("[LearningEngine] Loaded {} rules, {} contexts from {}",
                    loaded.getRules().size(), loaded.getContexts().size(), learnFile);
            return loaded;
        } catch (IOException e) {
            log.warn("[LearningEngine] Learning data at {} is unreadable, starting fresh: {}",
                    learnFile, e.getMessage());
            return new LearningData();
        }
    }

    private void save() {
        try {
            String json = JsonMappers.documentWriter(mapper).writeValueAsString(data()) + "\n";
            AtomicFileWriter.write(learnFile, json.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new OperationalException("Failed to save learning data to " + learnFile, e);
        }
    }

    /** Forgets everything and deletes the learning file. */
    public synchronized void reset() {
        data = new LearningData();
        try {
            Files.deleteIfExists(learnFile);
        } catch (IOException e) {
            throw new OperationalException("Failed to delete learning data at " + learnFile, e);
        }
        log.info("[LearningEngine] Learning data reset");
    }

    // ================================================================
    // Recording
    // ================================================================

    public void recordOutcome(String ruleId, Outcome outcome) {
        recordOutcome(ruleId, outcome, null, null);
    }

    /**
     * Counts one outcome for {@code ruleId}, and for {@code contextKey} when given.
     *
     * With a {@code filePath}, a revert extends the rule's consecutive-revert streak on
     * that file and any other outcome ends it.
     */
    public synchronized void recordOutcome(String ruleId, Outcome outcome, String contextKey, String filePath) {
        LearningData current = data();
        double nowSeconds = clock.millis() / 1000.0;

        RuleStats stats = current.getRules().computeIfAbsent(ruleId, k -> new RuleStats());
        stats.record(outcome, filePath, nowSeconds);

        if (contextKey != null) {
            current.getContexts().computeIfAbsent(contextKey, k -> new ContextStats()).record(outcome);
        }

        if (outcome == Outcome.REVERTED && filePath != null
                && stats.consecutiveRevertsFor(filePath) == REVERT_THRESHOLD_SKIPLIST) {
            log.warn("[LearningEngine] {} reverted {} times in a row on {}, auto-skipping",
                    ruleId, REVERT_THRESHOLD_SKIPLIST, filePath);
        }
        log.debug("[LearningEngine] Recorded {} for {} (context={}, file={})",
                outcome.wireName(), ruleId, contextKey, filePath);

        save();
    }

    // ================================================================
    // Skip decisions
    // ================================================================

    public synchronized boolean shouldSkipFileForRule(String ruleId, String filePath) {
        RuleStats stats = data().getRules().get(ruleId);
        return stats != null && stats.consecutiveRevertsFor(filePath) >= REVERT_THRESHOLD_SKIPLIST;
    }

    public synchronized boolean shouldSkipContext(String contextKey, double threshold) {
        ContextStats stats = data().getContexts().get(contextKey);
        return stats != null
                && stats.getHits() >= MIN_CONTEXT_HITS
                && stats.getRevertRate() > threshold;
    }

    /**
     * Fingerprint of a plan's situation: {@code file:rule:hash8} of its first finding,
     * where hash8 covers the first 100 characters of the snippet. Plan ids play no part.
     */
    public static String contextKey(EditPlan plan) {
        if (plan.getFindings().isEmpty()) {
            return NO_FINDINGS_CONTEXT;
        }
        Finding finding = plan.getFindings().get(0);
        String snippet = finding.getSnippet();
        if (snippet.length() > SNIPPET_PREFIX_LENGTH) {
            snippet = snippet.substring(0, SNIPPET_PREFIX_LENGTH);
        }
        String snippetHash = ContentHasher.shortHash(ContentHasher.sha256(snippet), SNIPPET_HASH_LENGTH);
        return finding.getFile() + ":" + finding.getRule() + ":" + snippetHash;
    }

    public static List<String> ruleIdsFromPlan(EditPlan plan) {
        return plan.getRuleIds();
    }

    // ================================================================
    // Thresholds
    // ================================================================

    /** Auto threshold for {@code ruleId}, tuned from its history. */
    public synchronized double tunedThreshold(String ruleId) {
        LearningData current = data();
        double base = current.tuningValue(LearningData.TUNING_MIN_AUTO, Thresholds.DEFAULT_AUTO);

        RuleStats stats = ruleId == null ? null : current.getRules().get(ruleId);
        if (stats == null || stats.getTotalActions() < MIN_SAMPLE) {
            return clamp(base);
        }

        double threshold = base;
        if (stats.getRevertRate() > HIGH_REVERT_RATE) {
            threshold = Math.min(CEIL_MIN_AUTO, threshold + DELTA);
        } else if (stats.getApplyRate() > HIGH_APPLY_RATE) {
            threshold = Math.max(FLOOR_MIN_AUTO, threshold - DELTA);
        }
        return clamp(threshold);
    }

    public synchronized Thresholds tunedThresholds(String ruleId) {
        double suggest = data().tuningValue(LearningData.TUNING_MIN_SUGGEST, Thresholds.DEFAULT_SUGGEST);
        return new Thresholds(tunedThreshold(ruleId), suggest);
    }

    private static double clamp(double threshold) {
        return Math.max(FLOOR_MIN_AUTO, Math.min(CEIL_MIN_AUTO, threshold));
    }

    // ================================================================
    // Reporting
    // ================================================================

    public synchronized Optional<RuleStats> getRuleStats(String ruleId) {
        return Optional.ofNullable(data().getRules().get(ruleId));
    }

    public synchronized Optional<ContextStats> getContextStats(String contextKey) {
        return Optional.ofNullable(data().getContexts().get(contextKey));
    }

    public synchronized Map<String, Double> getTuning() {
        return new TreeMap<>(data().getTuning());
    }

    /** Rules with enough data whose threshold moved off the default, most conservative first. */
    public synchronized List<RuleInsight> getTunedRules() {
        List<RuleInsight> tuned = new ArrayList<>();
        for (Map.Entry<String, RuleStats> e : data().getRules().entrySet()) {
            if (e.getValue().getTotalActions() < MIN_SAMPLE) continue;
            double threshold = tunedThreshold(e.getKey());
            if (Math.abs(threshold - Thresholds.DEFAULT_AUTO) > 0.001) {
                tuned.add(new RuleInsight(e.getKey(), e.getValue(), threshold));
            }
        }
        tuned.sort(Comparator.comparingDouble(RuleInsight::getTunedThreshold).reversed()
                .thenComparing(RuleInsight::getRuleId));
        return tuned;
    }

    public synchronized List<RuleInsight> getTopRulesByRevertRate(int limit) {
        List<RuleInsight> rules = new ArrayList<>();
        for (Map.Entry<String, RuleStats> e : data().getRules().entrySet()) {
            if (e.getValue().getTotalActions() < 2) continue;
            rules.add(new RuleInsight(e.getKey(), e.getValue(), tunedThreshold(e.getKey())));
        }
        rules.sort(Comparator.comparingDouble(RuleInsight::getRevertRate).reversed()
                .thenComparing(RuleInsight::getRuleId));
        return rules.size() > limit ? new ArrayList<>(rules.subList(0, limit)) : rules;
    }

    public Path getLearnFile() {
        return learnFile;
    }
}
