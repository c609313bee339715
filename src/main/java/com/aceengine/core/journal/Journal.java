package com.aceengine.core.journal;

import com.aceengine.config.JsonMappers;
import com.aceengine.config.Timestamps;
import com.aceengine.core.receipt.Receipt;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Journal — append-only JSON-Lines log of one run's file modifications.
 *
 * Location: .ace/journals/&lt;run_id&gt;.jsonl
 *
 * Every entry is flushed and forced to disk before the call returns, so an
 * intent is durable before the target file is touched and a success is only
 * recorded after the write is committed. A closed journal rejects writes, and an
 * existing journal file is never reopened: opening a run id twice fails with
 * {@link java.nio.file.FileAlreadyExistsException}.
 *
 * Lifecycle: open → logIntent* → logSuccess* / logRevert* → close
 */
public class Journal implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(Journal.class);

    private final String       runId;
    private final Path         path;
    private final Clock        clock;
    private final ObjectMapper mapper;

    private FileChannel channel;
    private boolean     closed = false;

    public Journal(String runId, Path journalDir, Clock clock) throws IOException {
        this.runId  = runId;
        this.path   = journalDir.resolve(runId + ".jsonl");
        this.clock  = clock;
        this.mapper = JsonMappers.sorted();

        Files.createDirectories(journalDir);
        this.channel = FileChannel.open(path,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        log.info("[Journal] Opened {}", path);
    }

    // ================================================================
    // Entries
    // ================================================================

    public synchronized IntentEntry logIntent(String file, String beforeSha, long beforeSize,
                                              Collection<String> ruleIds, String planId,
                                              String preImage) throws IOException {
        return logIntent(file, beforeSha, beforeSize, ruleIds, planId, preImage, null);
    }

    public synchronized IntentEntry logIntent(String file, String beforeSha, long beforeSize,
                                              Collection<String> ruleIds, String planId,
                                              String preImage, String contextKey) throws IOException {
        List<String> sortedRules = new ArrayList<>(ruleIds);
        Collections.sort(sortedRules);
        IntentEntry entry = new IntentEntry(now(), file, beforeSha, beforeSize,
                sortedRules, planId, preImage, contextKey);
        append(entry);
        return entry;
    }

    public synchronized SuccessEntry logSuccess(String file, String afterSha, long afterSize,
                                                String receiptId, Receipt receipt) throws IOException {
        SuccessEntry entry = new SuccessEntry(now(), file, afterSha, afterSize, receiptId, receipt);
        append(entry);
        return entry;
    }

    public synchronized SuccessEntry logSuccess(String file, String afterSha, long afterSize,
                                                String receiptId) throws IOException {
        return logSuccess(file, afterSha, afterSize, receiptId, null);
    }

    public synchronized RevertEntry logRevert(String file, String fromSha, String toSha,
                                              String reason) throws IOException {
        RevertEntry entry = new RevertEntry(now(), file, fromSha, toSha, reason);
        append(entry);
        return entry;
    }

    // ================================================================
    // Lifecycle
    // ================================================================

    @Override
    public synchronized void close() throws IOException {
        if (closed) return;
        closed = true;
        try {
            channel.force(true);
        } finally {
            channel.close();
            channel = null;
        }
        log.info("[Journal] Closed {}", path.getFileName());
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public String getRunId() {
        return runId;
    }

    public Path getPath() {
        return path;
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private void append(JournalEntry entry) throws IOException {
        if (closed) {
            throw new IllegalStateException("Journal " + runId + " is closed");
        }
        String line = mapper.writeValueAsString(entry) + "\n";
        ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        channel.force(true);
    }

    private String now() {
        return Timestamps.now(clock);
    }
}
