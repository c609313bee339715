package com.aceengine;

import com.aceengine.config.AcePaths;
import com.aceengine.core.analysis.AnalysisRun;
import com.aceengine.core.analysis.AnalysisService;
import com.aceengine.core.analysis.Analyzer;
import com.aceengine.core.analysis.Codemod;
import com.aceengine.core.edit.Edit;
import com.aceengine.core.edit.EditPlan;
import com.aceengine.core.edit.Finding;
import com.aceengine.core.edit.Severity;
import com.aceengine.core.learning.LearningEngine;
import com.aceengine.orchestrator.PipelineResult;
import com.aceengine.orchestrator.PlanOutcome;
import com.aceengine.orchestrator.RevertService;
import com.aceengine.orchestrator.RevertSummary;
import com.aceengine.orchestrator.TransformationPipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.util.FileSystemUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class AceEngineApplicationTest {

    private static final String CALC = """
            def add(a, b):
                print("adding")
                return a + b
            """;

    @Autowired
    private AcePaths paths;

    @Autowired
    private AnalysisService analysis;

    @Autowired
    private TransformationPipeline pipeline;

    @Autowired
    private RevertService revertService;

    @Autowired
    private LearningEngine learning;

    private Path calc;

    @BeforeEach
    void setUp() throws Exception {
        FileSystemUtils.deleteRecursively(paths.stateDir());
        learning.reset();
        Files.createDirectories(paths.workspaceRoot());
        calc = paths.workspaceRoot().resolve("calc.py");
        Files.writeString(calc, CALC);
    }

    @Test
    void testWorkspaceComesFromTestProfile() {
        assertTrue(paths.workspaceRoot().endsWith(Path.of("target", "test-workspace")));
    }

    @Test
    void testAnalyzePlanApplyRevert() throws Exception {
        Analyzer printCalls = file -> {
            List<String> lines = Files.readAllLines(file);
            List<Finding> findings = new ArrayList<>();
            for (int i = 0; i < lines.size(); i++) {
                if (lines.get(i).trim().startsWith("print(")) {
                    findings.add(new Finding(paths.relativize(file), i + 1, "no-print", Severity.CRITICAL,
                            "print call", lines.get(i).trim()));
                }
            }
            return findings;
        };
        Codemod dropPrints = (file, content, findings) -> {
            List<EditPlan> plans = new ArrayList<>();
            for (Finding finding : findings) {
                plans.add(new EditPlan("drop-print-" + finding.getLine(),
                        List.of(Edit.delete(finding.getFile(), finding.getLine(), finding.getLine())),
                        List.of(finding), List.of("return value unchanged"), 0.1));
            }
            return plans;
        };

        AnalysisRun run = analysis.analyze(printCalls, List.of(calc), false);
        assertEquals(1, run.getFindings().size());

        List<EditPlan> plans = dropPrints.plan(calc, Files.readString(calc), run.getFindings());
        PipelineResult result = pipeline.run(plans);

        assertEquals(PlanOutcome.Status.APPLIED, result.outcomeFor("drop-print-2").orElseThrow().getStatus());
        assertEquals("def add(a, b):\n    return a + b\n", Files.readString(calc));
        assertEquals(List.of(), pipeline.verifyIntegrity());

        RevertSummary summary = revertService.revert(result.getRunId());

        assertTrue(summary.isComplete());
        assertEquals(CALC, Files.readString(calc));
        assertEquals(1, learning.getRuleStats("no-print").orElseThrow().getReverted());
    }
}
