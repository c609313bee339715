package com.aceengine.core.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Second-opinion parse check that hands the source to a real Python interpreter.
 *
 * On by default ({@code ace.guard.interpreter-check}); the executable comes from
 * {@code ace.guard.python-interpreter} and falls back to {@code python3}. The
 * source is piped on stdin to {@code ast.parse}; nothing is executed and nothing
 * touches the workspace. A check that cannot run counts as a failure.
 */
@Component
public class PythonInterpreterCheck {

    private static final Logger log = LoggerFactory.getLogger(PythonInterpreterCheck.class);

    private static final String DEFAULT_INTERPRETER = "python3";
    private static final int    TIMEOUT_SECONDS     = 30;

    private static final String PARSE_SCRIPT =
            "import ast, sys\n"
            + "src = sys.stdin.buffer.read().decode('utf-8')\n"
            + "try:\n"
            + "    ast.parse(src)\n"
            + "except SyntaxError as e:\n"
            + "    print('SyntaxError: %s (line %s)' % (e.msg, e.lineno))\n"
            + "    sys.exit(1)\n";

    private final boolean enabled;
    private final String  interpreter;

    @Autowired
    public PythonInterpreterCheck(
            @Value("${ace.guard.interpreter-check:true}") boolean enabled,
            @Value("${ace.guard.python-interpreter:}") String interpreter
    ) {
        this.enabled     = enabled;
        this.interpreter = resolveInterpreter(interpreter);
        if (enabled) {
            log.info("[PythonInterpreterCheck] Using interpreter: {}", this.interpreter);
        } else {
            log.warn("[PythonInterpreterCheck] Disabled; parse guard relies on the token checker only");
        }
    }

    /** Enabled check with the given executable ({@code python3} when blank). */
    public PythonInterpreterCheck(String interpreter) {
        this(true, interpreter);
    }

    public static PythonInterpreterCheck disabled() {
        return new PythonInterpreterCheck(false, "");
    }

    static String resolveInterpreter(String configured) {
        if (configured == null || configured.isBlank()) {
            return DEFAULT_INTERPRETER;
        }
        return configured.trim();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getInterpreter() {
        return interpreter;
    }

    public CheckResult check(String source) {
        if (!isEnabled()) {
            return CheckResult.ok();
        }

        List<String> command = List.of(interpreter, "-c", PARSE_SCRIPT);
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectErrorStream(true);
            Process process = builder.start();

            StringBuilder output = new StringBuilder();
            Thread reader = new Thread(() -> {
                try (BufferedReader in = new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = in.readLine()) != null) {
                        output.append(line).append("\n");
                    }
                } catch (IOException e) {
                    log.warn("[PythonInterpreterCheck] Error reading output: {}", e.getMessage());
                }
            });
            reader.start();

            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(source.getBytes(StandardCharsets.UTF_8));
            }

            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly().waitFor();
                reader.join();
                log.warn("[PythonInterpreterCheck] Timed out after {} seconds", TIMEOUT_SECONDS);
                return CheckResult.failed("Interpreter parse check timed out after " + TIMEOUT_SECONDS + "s");
            }
            // The reader ends at EOF once the process has exited; all output is in.
            reader.join();

            if (process.exitValue() == 0) {
                return CheckResult.ok();
            }
            String message = output.toString().trim();
            return CheckResult.failed(message.isEmpty()
                    ? "Interpreter rejected source (exit " + process.exitValue() + ")"
                    : message);

        } catch (IOException e) {
            log.error("[PythonInterpreterCheck] Could not run {}: {}", interpreter, e.getMessage());
            return CheckResult.failed("Interpreter parse check unavailable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CheckResult.failed("Interpreter parse check interrupted");
        }
    }
}
