package com.aceengine.core.policy;

import com.aceengine.core.edit.EditPlan;
import com.aceengine.core.edit.Finding;
import com.aceengine.core.filesystem.ContentHasher;
import com.aceengine.core.learning.LearningEngine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * PolicyEngine — scores plans (R*) and maps scores to decisions.
 *
 *   R* = alpha * value + beta * impact       (alpha 0.7, beta 0.3)
 *
 * There is no risk term. Thresholds come from {@link LearningEngine} per rule,
 * never from constants, so the feedback loop reaches every decision.
 */
@Component
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    public static final double DEFAULT_ALPHA = 0.7;
    public static final double DEFAULT_BETA  = 0.3;

    /** Edits at which a plan's derived impact saturates at 1.0. */
    static final int IMPACT_SATURATION_EDITS = 10;

    static final double PRIORITY_SCALE           = 100.0;
    static final double REVERTED_CONTEXT_PENALTY = 20.0;
    static final double CONTEXT_REVERT_THRESHOLD = 0.5;

    private final LearningEngine learning;

    public PolicyEngine(LearningEngine learning) {
        this.learning = learning;
    }

    // ================================================================
    // Scoring
    // ================================================================

    public static double rstar(double value, double impact) {
        return rstar(value, impact, DEFAULT_ALPHA, DEFAULT_BETA);
    }

    public static double rstar(double value, double impact, double alpha, double beta) {
        return alpha * value + beta * impact;
    }

    public static PolicyDecision decision(double score, Thresholds thresholds) {
        if (score >= thresholds.getAuto()) {
            return PolicyDecision.AUTO;
        }
        if (score >= thresholds.getSuggest()) {
            return PolicyDecision.SUGGEST;
        }
        return PolicyDecision.DENY;
    }

    /** Highest severity weight among the plan's findings; 0 with no findings. */
    static double derivedValue(EditPlan plan) {
        double value = 0.0;
        for (Finding finding : plan.getFindings()) {
            value = Math.max(value, finding.getSeverity().getWeight());
        }
        return value;
    }

    static double derivedImpact(EditPlan plan) {
        return Math.min(1.0, (double) plan.getEdits().size() / IMPACT_SATURATION_EDITS);
    }

    public double scorePlan(EditPlan plan, PolicyContext context) {
        double value  = context.getValue().orElse(derivedValue(plan));
        double impact = context.getImpact().orElse(derivedImpact(plan));
        return rstar(value, impact);
    }

    /**
     * Short fingerprint of the scoring parameters a decision was made with; sealed
     * into receipts so a later reader can tell which policy approved a change.
     */
    public static String policyHash(Thresholds thresholds) {
        String material = String.format(Locale.ROOT, "alpha=%.4f;beta=%.4f;auto=%.4f;suggest=%.4f",
                DEFAULT_ALPHA, DEFAULT_BETA, thresholds.getAuto(), thresholds.getSuggest());
        return ContentHasher.shortHash(ContentHasher.sha256(material), 16);
    }

    // ================================================================
    // Enforcement
    // ================================================================

    public PolicyEvaluation enforcePolicy(EditPlan plan) {
        return enforcePolicy(plan, PolicyContext.empty());
    }

    /**
     * Scores {@code plan} against the tuned thresholds of its primary rule.
     *
     * A plan is denied outright when learning has auto-skipped its primary rule on
     * any file the plan touches.
     */
    public PolicyEvaluation enforcePolicy(EditPlan plan, PolicyContext context) {
        String     rule       = plan.primaryRule();
        Thresholds thresholds = learning.tunedThresholds(rule);
        double     score      = scorePlan(plan, context);

        List<String> reasons = new ArrayList<>();
        if (rule != null) {
            for (String file : plan.files()) {
                if (learning.shouldSkipFileForRule(rule, file)) {
                    reasons.add("Rule " + rule + " is auto-skipped for " + file
                            + " after " + LearningEngine.REVERT_THRESHOLD_SKIPLIST + " consecutive reverts");
                }
            }
        }

        PolicyDecision decision;
        if (!reasons.isEmpty()) {
            decision = PolicyDecision.DENY;
        } else {
            decision = decision(score, thresholds);
            reasons.add(String.format(Locale.ROOT, "R*=%.3f vs auto=%.2f, suggest=%.2f",
                    score, thresholds.getAuto(), thresholds.getSuggest()));
        }

        PolicyEvaluation evaluation = new PolicyEvaluation(plan.getId(), score, thresholds, decision, reasons);
        log.info("[PolicyEngine] {} → {} (score={}, rule={})",
                plan.getId(), decision.wireName(), String.format("%.3f", score), rule);
        return evaluation;
    }

    // ================================================================
    // Prioritization
    // ================================================================

    /** 100 * R*, minus 20 when the plan's context has a history of reverts. */
    public double priority(EditPlan plan) {
        double priority = PRIORITY_SCALE * scorePlan(plan, PolicyContext.empty());
        if (learning.shouldSkipContext(LearningEngine.contextKey(plan), CONTEXT_REVERT_THRESHOLD)) {
            priority -= REVERTED_CONTEXT_PENALTY;
        }
        return priority;
    }

    /** Plans by priority descending, then plan id; the input is not modified. */
    public List<EditPlan> prioritize(List<EditPlan> plans) {
        Map<String, Double> priorities = new HashMap<>();
        for (EditPlan plan : plans) {
            priorities.put(plan.getId(), priority(plan));
        }
        List<EditPlan> ordered = new ArrayList<>(plans);
        ordered.sort(Comparator
                .comparing((EditPlan p) -> priorities.get(p.getId()), Comparator.reverseOrder())
                .thenComparing(EditPlan::getId));
        return ordered;
    }
}
