package com.aceengine.core.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * PolicyEvaluation — immutable outcome of {@link PolicyEngine#enforcePolicy}.
 *
 * Carries the score and the thresholds it was compared against, so a reader can
 * tell why a plan landed where it did without re-running the engine.
 */
public final class PolicyEvaluation {

    @JsonProperty("plan_id")
    private final String         planId;

    @JsonProperty("score")
    private final double         score;

    @JsonProperty("thresholds")
    private final Thresholds     thresholds;

    @JsonProperty("decision")
    private final PolicyDecision decision;

    @JsonProperty("reasons")
    private final List<String>   reasons;

    public PolicyEvaluation(
            String         planId,
            double         score,
            Thresholds     thresholds,
            PolicyDecision decision,
            List<String>   reasons
    ) {
        this.planId     = planId;
        this.score      = score;
        this.thresholds = thresholds;
        this.decision   = decision;
        this.reasons    = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public String         getPlanId()     { return planId; }
    public double         getScore()      { return score; }
    public Thresholds     getThresholds() { return thresholds; }
    public PolicyDecision getDecision()   { return decision; }
    public List<String>   getReasons()    { return reasons; }

    public boolean isAuto()    { return decision == PolicyDecision.AUTO;    }
    public boolean isSuggest() { return decision == PolicyDecision.SUGGEST; }
    public boolean isDeny()    { return decision == PolicyDecision.DENY;    }

    @Override
    public String toString() {
        return String.format("PolicyEvaluation{plan=%s, decision=%s, score=%.3f, %s}",
                planId, decision.wireName(), score, thresholds);
    }
}
