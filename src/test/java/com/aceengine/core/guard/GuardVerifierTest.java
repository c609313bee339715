package com.aceengine.core.guard;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GuardVerifierTest {

    private static final Path FILE = Path.of("calc.py");

    private static final String BEFORE = """
            def add(a, b):
                return a + b
            """;

    private final GuardVerifier guard = new GuardVerifier();

    @TempDir
    Path tempDir;

    @Test
    void testValidEditPassesAllLayers() {
        String after = """
                def add(a, b):
                    total = a + b
                    return total
                """;

        GuardResult result = guard.guardEdit(FILE, BEFORE, after);

        assertTrue(result.isPassed());
        assertEquals(GuardType.ALL, result.getGuardType());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void testMissingColonFailsParse() {
        String after = """
                def add(a, b)
                    return a + b
                """;

        GuardResult result = guard.guardEdit(FILE, BEFORE, after);

        assertFalse(result.isPassed());
        assertEquals(GuardType.PARSE, result.getGuardType());
        assertTrue(result.getErrors().get(0).startsWith("SyntaxError"));
    }

    @Test
    void testUnclosedBracketFailsParse() {
        GuardResult result = guard.guardEdit(FILE, BEFORE, "def add(a, b:\n    return a + b\n");

        assertFalse(result.isPassed());
        assertEquals(GuardType.PARSE, result.getGuardType());
    }

    @Test
    void testMissingCommaFailsParse() {
        assertFalse(guard.verifyPythonParse("print(a b)\n").isOk());
        assertTrue(guard.verifyPythonParse("print(a, b)\n").isOk());
    }

    @Test
    void testBlockWithoutBodyFailsParse() {
        assertFalse(guard.verifyPythonParse("if ready:\nx = 1\n").isOk());
    }

    @Test
    void testStrictModeAcceptsFormattingOnlyChanges() {
        String before = "x = 'a'\ny = 1\n";
        String after  = "x  =  \"a\"   # same value\n\ny = 1\n";

        GuardResult result = guard.guardEdit(FILE, before, after, true);

        assertTrue(result.isPassed(), () -> result.getErrors().toString());
    }

    @Test
    void testStrictModeRejectsSemanticChange() {
        GuardResult result = guard.guardEdit(FILE, "x = 1\n", "x = 2\n", true);

        assertFalse(result.isPassed());
        assertEquals(GuardType.AST_EQUIV, result.getGuardType());
    }

    @Test
    void testNonStrictModeAllowsSemanticChange() {
        assertTrue(guard.guardEdit(FILE, "x = 1\n", "x = 2\n", false).isPassed());
    }

    @Test
    void testGuardFileEditPassesNonPythonFiles() throws Exception {
        Path readme = tempDir.resolve("README.md");
        Files.writeString(readme, "# Title\n");

        GuardResult result = guard.guardFileEdit(readme, "def broken(:\n", false);

        assertTrue(result.isPassed());
        assertEquals(GuardType.NON_PYTHON, result.getGuardType());
    }

    @Test
    void testGuardFileEditReportsUnreadableFile() {
        GuardResult result = guard.guardFileEdit(tempDir.resolve("missing.py"), "x = 1\n", false);

        assertFalse(result.isPassed());
        assertEquals(GuardType.READ, result.getGuardType());
    }

    @Test
    void testInvalidStatementsFailWithoutInterpreter() {
        List<String> invalid = List.of(
                "1 = x\n",
                "if x = 1:\n    pass\n",
                "else:\n    pass\n",
                "x = 1\nelse:\n    pass\n",
                "return return\n",
                "x = 1 +* 2\n",
                "lambda: = 3\n",
                "f(a=1, a)\n");

        for (String source : invalid) {
            CheckResult result = guard.verifyPythonParse(source);
            assertFalse(result.isOk(), () -> "accepted: " + source);
            assertTrue(result.getErrors().get(0).startsWith("SyntaxError"), result.getErrors()::toString);
        }
    }

    @Test
    void testMoreInvalidShapesFailParse() {
        assertFalse(guard.verifyPythonParse("print(x) = 1\n").isOk());
        assertFalse(guard.verifyPythonParse("'a' = 1\n").isOk());
        assertFalse(guard.verifyPythonParse("a + b = 1\n").isOk());
        assertFalse(guard.verifyPythonParse("None = 1\n").isOk());
        assertFalse(guard.verifyPythonParse("def f(a=1, b):\n    pass\n").isOk());
        assertFalse(guard.verifyPythonParse("try:\n    pass\nelif x:\n    pass\n").isOk());
        assertFalse(guard.verifyPythonParse("if x:\n    pass\nx = 1\nexcept:\n    pass\n").isOk());
        assertFalse(guard.verifyPythonParse("x = 1 if y pass\n").isOk());
    }

    @Test
    void testValidModuleWithAssignmentsAndArgumentsPasses() {
        String module = """
                from os import path
                import sys, re as regex

                @decorator(name="x", flags=[1, 2])
                class Point(Base, metaclass=Meta):
                    x: int = 0
                    label: "str" = "p"

                    def __init__(self, a, b=1, *args, c, d=2, **kwargs):
                        self.a, self.b = a, b
                        first, *rest = args
                        data[0], data[1:3] = 1, [2, 3]
                        handler = lambda value, scale=2: value * scale
                        total = 0
                        for i in range(10):
                            total += i
                        else:
                            total = -1

                    async def run(self, /, key=None, *, retries=3):
                        async with lock as held:
                            pass
                        try:
                            result = await fetch(key, timeout=5, *extra, **options)
                        except (ValueError, KeyError) as error:
                            raise RuntimeError("failed") from error
                        except Exception:
                            raise
                        else:
                            return result
                        finally:
                            cleanup()

                def pick(flag):
                    if flag == 1:
                        return "one"
                    elif (n := flag) > 1:
                        return n
                    else:
                        return None

                match command:
                    case {"action": action, **rest} if action != "":
                        print(action, end="")
                    case [first, *others]:
                        pass
                    case _:
                        pass

                value = x if x else y; count = 0
                match = 1
                type = None
                while count < 3: count += 1
                """;

        CheckResult result = guard.verifyPythonParse(module);

        assertTrue(result.isOk(), result.getErrors()::toString);
    }

    @Test
    void testInterpreterCheckDefaultsToPython3() {
        PythonInterpreterCheck check = new PythonInterpreterCheck("  ");

        assertTrue(check.isEnabled());
        assertEquals("python3", check.getInterpreter());
        assertEquals("/usr/bin/python3.12", new PythonInterpreterCheck(" /usr/bin/python3.12 ").getInterpreter());
    }

    @Test
    void testDisabledInterpreterCheckAlwaysPasses() {
        PythonInterpreterCheck check = PythonInterpreterCheck.disabled();

        assertFalse(check.isEnabled());
        assertTrue(check.check("not python at all (").isOk());
    }

    @Test
    void testInterpreterCheckRejectsWhatTheTokenCheckerCannotSee() {
        PythonInterpreterCheck check = new PythonInterpreterCheck("python3");
        assumeTrue(check.check("x = 1\n").isOk(), "python3 not available");

        assertFalse(check.check("del f()\n").isOk());
        assertFalse(check.check("1 = x\n").isOk());

        GuardVerifier withInterpreter = new GuardVerifier(check, false);
        assertTrue(guard.verifyPythonParse("del f()\n").isOk());
        assertTrue(withInterpreter.verifyPythonParse(BEFORE).isOk());
        assertTrue(withInterpreter.verifyPythonParse("del f()\n").getErrors().get(0).contains("SyntaxError"));
    }

    @Test
    void testStrictModeDistinguishesBytesFromUnicodeEscapes() {
        assertTrue(guard.verifyAstEquivalence("x = '\\u0041'\n", "x = 'A'\n").isOk());
        assertFalse(guard.verifyAstEquivalence("x = b'\\u0041'\n", "x = b'A'\n").isOk());
        assertFalse(guard.verifyAstEquivalence("x = b'\\U00000041'\n", "x = b'A'\n").isOk());
        assertTrue(guard.verifyAstEquivalence("x = b'\\x41'\n", "x = b'A'\n").isOk());
    }

    @Test
    void testSummaryAndFormatting() {
        GuardResult pass = guard.guardEdit(FILE, BEFORE, BEFORE);
        GuardResult fail = guard.guardEdit(FILE, BEFORE, "def add(a, b)\n");

        Map<String, Object> summary = GuardVerifier.getGuardSummary(List.of(pass, fail));
        assertEquals(2, summary.get("total"));
        assertEquals(1, summary.get("passed"));
        assertEquals(0.5, (Double) summary.get("pass_rate"), 1e-9);
        assertEquals(Map.of("parse", 1), summary.get("failures_by_type"));

        String text = GuardVerifier.formatGuardError(fail);
        assertTrue(text.contains("PATCH GUARD FAILED"));
        assertTrue(text.contains("calc.py"));
    }
}
