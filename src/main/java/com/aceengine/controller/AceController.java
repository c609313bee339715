package com.aceengine.controller;

import com.aceengine.core.error.AceException;
import com.aceengine.core.index.ContentIndex;
import com.aceengine.core.learning.LearningEngine;
import com.aceengine.core.learning.RuleInsight;
import com.aceengine.core.policy.Thresholds;
import com.aceengine.orchestrator.RevertService;
import com.aceengine.orchestrator.RevertSummary;
import com.aceengine.orchestrator.TransformationPipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator surface: integrity check, revert, learning and index inspection.
 */
@RestController
@RequestMapping("/ace")
public class AceController {

    private static final Logger log = LoggerFactory.getLogger(AceController.class);

    private final TransformationPipeline pipeline;
    private final RevertService          revertService;
    private final LearningEngine         learning;
    private final ContentIndex           index;

    public AceController(
            TransformationPipeline pipeline,
            RevertService          revertService,
            LearningEngine         learning,
            ContentIndex           index
    ) {
        this.pipeline      = pipeline;
        this.revertService = revertService;
        this.learning      = learning;
        this.index         = index;
    }

    @GetMapping("/receipts/verify")
    public ResponseEntity<Map<String, Object>> verifyReceipts() {
        List<String> failures = pipeline.verifyIntegrity();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", failures.isEmpty());
        body.put("failures", failures);
        return ResponseEntity.ok(body);
    }

    /** Reverts {@code run_id} when given, otherwise the most recent run. */
    @PostMapping("/revert")
    public ResponseEntity<RevertSummary> revert(
            @RequestBody(required = false) Map<String, String> request
    ) {
        String runId = request == null ? null : request.get("run_id");

        RevertSummary summary = (runId == null || runId.trim().isEmpty())
                ? revertService.revertLatest()
                : revertService.revert(runId.trim());

        return ResponseEntity.ok(summary);
    }

    @GetMapping("/learning/rules/{ruleId}/thresholds")
    public ResponseEntity<Map<String, Object>> thresholds(@PathVariable String ruleId) {
        Thresholds thresholds = learning.tunedThresholds(ruleId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("rule_id", ruleId);
        body.put("auto", thresholds.getAuto());
        body.put("suggest", thresholds.getSuggest());
        learning.getRuleStats(ruleId).ifPresent(stats -> {
            body.put("applied", stats.getApplied());
            body.put("reverted", stats.getReverted());
            body.put("suggested", stats.getSuggested());
            body.put("skipped", stats.getSkipped());
        });
        return ResponseEntity.ok(body);
    }

    @GetMapping("/learning/rules/tuned")
    public ResponseEntity<List<RuleInsight>> tunedRules() {
        return ResponseEntity.ok(learning.getTunedRules());
    }

    @GetMapping("/learning/rules/reverted")
    public ResponseEntity<List<RuleInsight>> mostRevertedRules(
            @RequestParam(name = "limit", defaultValue = "10") int limit
    ) {
        if (limit < 1) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(learning.getTopRulesByRevertRate(limit));
    }

    @GetMapping("/index/stats")
    public ResponseEntity<Map<String, Long>> indexStats() {
        return ResponseEntity.ok(index.getStats());
    }

    // =========================================================================
    // Errors
    // =========================================================================

    @ExceptionHandler(AceException.class)
    public ResponseEntity<Map<String, Object>> handleAceException(AceException e) {
        HttpStatus status = switch (e.getExitCode()) {
            case INVALID_ARGS -> HttpStatus.BAD_REQUEST;
            case POLICY_DENY  -> HttpStatus.CONFLICT;
            default           -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        log.warn("[AceController] {} → {}", e.format(), status.value());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("exit_code", e.getExitCode().getCode());
        return ResponseEntity.status(status).body(body);
    }
}
