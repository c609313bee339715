package com.aceengine.core.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * GuardVerifier — decides whether a proposed file transformation may be committed.
 *
 * Layers, in order (the first failing layer decides the result):
 *   1. parse      — the new content is valid Python
 *   2. ast_equiv  — before and after are the same program modulo formatting (strict mode only)
 *   3. cst_apply  — the new content survives a lossless token round-trip
 *
 * A result never partially passes. Non-Python files are passed through by
 * {@link #guardFileEdit}.
 */
@Component
public class GuardVerifier {

    private static final Logger log = LoggerFactory.getLogger(GuardVerifier.class);

    private final PythonInterpreterCheck interpreterCheck;
    private final boolean                strictByDefault;

    @Autowired
    public GuardVerifier(
            PythonInterpreterCheck interpreterCheck,
            @Value("${ace.guard.strict:false}") boolean strictByDefault
    ) {
        this.interpreterCheck = interpreterCheck;
        this.strictByDefault  = strictByDefault;
        log.info("[GuardVerifier] Strict mode by default: {}, interpreter check: {}",
                strictByDefault, interpreterCheck.isEnabled());
    }

    /** Token-level guard only, no external interpreter. */
    public GuardVerifier() {
        this(PythonInterpreterCheck.disabled(), false);
    }

    public boolean isStrictByDefault() {
        return strictByDefault;
    }

    // ================================================================
    // Layers
    // ================================================================

    public CheckResult verifyPythonParse(String source) {
        try {
            PythonSyntaxChecker.check(PythonTokenizer.tokenize(source));
        } catch (PythonSyntaxException e) {
            return CheckResult.failed("SyntaxError: " + e.getMessage());
        }
        return interpreterCheck.check(source);
    }

    public CheckResult verifyAstEquivalence(String before, String after) {
        List<String> normalizedBefore;
        List<String> normalizedAfter;
        try {
            normalizedBefore = NormalizedTokens.of(PythonTokenizer.tokenize(before));
            normalizedAfter  = NormalizedTokens.of(PythonTokenizer.tokenize(after));
        } catch (PythonSyntaxException e) {
            return CheckResult.failed("Parse error during AST comparison: " + e.getMessage());
        }

        if (!normalizedBefore.equals(normalizedAfter)) {
            return CheckResult.failed("AST structures differ (semantic change detected)");
        }
        return CheckResult.ok();
    }

    public CheckResult verifyCstRoundtrip(String source) {
        try {
            List<PythonToken> tokens = PythonTokenizer.tokenize(source);

            StringBuilder regenerated = new StringBuilder(source.length());
            for (PythonToken token : tokens) {
                regenerated.append(token.getText());
            }
            if (!regenerated.toString().equals(source)) {
                return CheckResult.failed("CST roundtrip did not reproduce the source");
            }

            if (!PythonTokenizer.tokenize(regenerated.toString()).equals(tokens)) {
                return CheckResult.failed("CST roundtrip produced different tree");
            }
        } catch (PythonSyntaxException e) {
            return CheckResult.failed("CST roundtrip error: " + e.getMessage());
        }
        return CheckResult.ok();
    }

    // ================================================================
    // Guards
    // ================================================================

    public GuardResult guardEdit(Path file, String before, String after) {
        return guardEdit(file, before, after, strictByDefault);
    }

    public GuardResult guardEdit(Path file, String before, String after, boolean strict) {
        String name = file.toString();

        CheckResult parse = verifyPythonParse(after);
        if (!parse.isOk()) {
            log.debug("[GuardVerifier] {} failed parse: {}", name, parse.getErrors());
            return GuardResult.fail(name, before, after, GuardType.PARSE, parse.getErrors());
        }

        if (strict) {
            CheckResult equivalence = verifyAstEquivalence(before, after);
            if (!equivalence.isOk()) {
                log.debug("[GuardVerifier] {} failed AST equivalence", name);
                return GuardResult.fail(name, before, after, GuardType.AST_EQUIV, equivalence.getErrors());
            }
        }

        CheckResult roundtrip = verifyCstRoundtrip(after);
        if (!roundtrip.isOk()) {
            log.debug("[GuardVerifier] {} failed round-trip: {}", name, roundtrip.getErrors());
            return GuardResult.fail(name, before, after, GuardType.CST_APPLY, roundtrip.getErrors());
        }

        return GuardResult.pass(name, before, after, GuardType.ALL);
    }

    /**
     * Guards an edit against the file's current on-disk content.
     */
    public GuardResult guardFileEdit(Path file, String after, boolean strict) {
        String before;
        try {
            before = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return GuardResult.fail(file.toString(), "", after, GuardType.READ,
                    List.of("Failed to read original file: " + e.getMessage()));
        }

        if (!isPythonFile(file)) {
            return GuardResult.pass(file.toString(), before, after, GuardType.NON_PYTHON);
        }
        return guardEdit(file, before, after, strict);
    }

    public static boolean isPythonFile(Path file) {
        return file.getFileName() != null && file.getFileName().toString().endsWith(".py");
    }

    // ================================================================
    // Reporting
    // ================================================================

    public static String formatGuardError(GuardResult result) {
        String rule = "=".repeat(60);
        StringBuilder sb = new StringBuilder();
        sb.append(rule).append('\n');
        sb.append("PATCH GUARD FAILED").append('\n');
        sb.append(rule).append('\n');
        sb.append("File: ").append(result.getFile()).append('\n');
        sb.append("Guard Type: ").append(result.getGuardType()).append('\n');
        sb.append('\n');
        sb.append("Errors:").append('\n');
        for (String error : result.getErrors()) {
            sb.append("  - ").append(error).append('\n');
        }
        sb.append('\n');
        sb.append("Action: Edit aborted, file left unchanged").append('\n');
        sb.append(rule);
        return sb.toString();
    }

    public static Map<String, Object> getGuardSummary(List<GuardResult> results) {
        int passed = 0;
        Map<String, Integer> failuresByType = new TreeMap<>();
        for (GuardResult result : results) {
            if (result.isPassed()) {
                passed++;
            } else {
                failuresByType.merge(result.getGuardType().getWireName(), 1, Integer::sum);
            }
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", results.size());
        summary.put("passed", passed);
        summary.put("failed", results.size() - passed);
        summary.put("pass_rate", results.isEmpty() ? 0.0 : (double) passed / results.size());
        summary.put("failures_by_type", failuresByType);
        return summary;
    }
}
