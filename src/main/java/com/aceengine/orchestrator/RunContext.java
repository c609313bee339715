package com.aceengine.orchestrator;

import com.aceengine.core.journal.Journal;
import com.aceengine.core.journal.JournalRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.UUID;

/**
 * State owned by one pipeline run, passed explicitly to every stage.
 *
 * The journal is opened on first use, so a run that commits nothing leaves no
 * journal file behind.
 */
public class RunContext implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final String            runId;
    private final Instant           startedAt;
    private final JournalRepository journals;

    private Journal journal;

    public RunContext(String runId, Instant startedAt, JournalRepository journals) {
        this.runId     = runId;
        this.startedAt = startedAt;
        this.journals  = journals;
    }

    /** {@code run-<yyyyMMdd-HHmmss>-<8 hex>}; sorts by start time. */
    public static String newRunId(Clock clock) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "run-" + RUN_ID_FORMAT.format(clock.instant()) + "-" + suffix;
    }

    public String getRunId() {
        return runId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Journal journal() throws IOException {
        if (journal == null) {
            journal = journals.open(runId);
        }
        return journal;
    }

    public synchronized Optional<Path> getJournalPath() {
        return journal == null ? Optional.empty() : Optional.of(journal.getPath());
    }

    @Override
    public synchronized void close() throws IOException {
        if (journal != null && !journal.isClosed()) {
            journal.close();
            log.debug("[RunContext] Closed journal for {}", runId);
        }
    }
}
