package com.aceengine.core.journal;

import com.aceengine.config.AcePaths;
import com.aceengine.config.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Opens run journals and reads them back.
 *
 * Revert plans pair each {@code success} with the most recent unpaired
 * {@code intent} for the same file. An intent that never got a success means the
 * write was not committed and produces no revert context.
 */
@Component
public class JournalRepository {

    private static final Logger log = LoggerFactory.getLogger(JournalRepository.class);

    public static final String JOURNAL_SUFFIX = ".jsonl";

    private final Path         journalsDir;
    private final Clock        clock;
    private final ObjectMapper mapper;

    public JournalRepository(AcePaths paths, Clock clock) {
        this.journalsDir = paths.journalsDir();
        this.clock       = clock;
        this.mapper      = JsonMappers.sorted();
    }

    public Journal open(String runId) throws IOException {
        return new Journal(runId, journalsDir, clock);
    }

    public Path getJournalsDir() {
        return journalsDir;
    }

    public Path pathFor(String runId) {
        return journalsDir.resolve(runId + JOURNAL_SUFFIX);
    }

    // ================================================================
    // Reading
    // ================================================================

    /**
     * Entries in write order. A missing file is an empty journal, not an error.
     *
     * @throws IOException if the file cannot be read or a line is not a journal entry
     */
    public List<JournalEntry> readJournal(Path journal) throws IOException {
        if (!Files.exists(journal)) {
            return List.of();
        }
        List<JournalEntry> entries = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(journal, StandardCharsets.UTF_8)) {
            String line;
            int    lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                try {
                    entries.add(mapper.readValue(line, JournalEntry.class));
                } catch (JsonProcessingException e) {
                    throw new IOException(journal.getFileName() + ":" + lineNo
                            + " - not a journal entry: " + e.getOriginalMessage(), e);
                }
            }
        }
        return entries;
    }

    /**
     * Revert contexts for every committed modification, in commit order.
     * Callers undo them most-recent-first.
     */
    public List<RevertContext> buildRevertPlan(Path journal) throws IOException {
        Map<String, IntentEntry> pending = new HashMap<>();
        List<RevertContext>      plan    = new ArrayList<>();

        for (JournalEntry entry : readJournal(journal)) {
            if (entry instanceof IntentEntry) {
                pending.put(entry.getFile(), (IntentEntry) entry);
            } else if (entry instanceof SuccessEntry) {
                IntentEntry intent = pending.remove(entry.getFile());
                if (intent == null) {
                    log.warn("[JournalRepository] Success without intent for {} in {}",
                            entry.getFile(), journal.getFileName());
                    continue;
                }
                SuccessEntry success = (SuccessEntry) entry;
                plan.add(new RevertContext(
                        intent.getFile(),
                        success.getAfterSha(),
                        intent.getBeforeSha(),
                        intent.getPreImage(),
                        intent.getPlanId(),
                        intent.getRuleIds(),
                        intent.getContextKey()));
            }
        }

        if (!pending.isEmpty()) {
            log.info("[JournalRepository] {} intent(s) without success in {} (never committed): {}",
                    pending.size(), journal.getFileName(), pending.keySet());
        }
        return plan;
    }

    // ================================================================
    // Discovery
    // ================================================================

    public List<Path> listJournals() throws IOException {
        return listJournals(journalsDir);
    }

    /** Journal files sorted by name. */
    public static List<Path> listJournals(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(JOURNAL_SUFFIX))
                        .sorted()
                        .collect(Collectors.toList());
        }
    }

    public Optional<Path> findLatestJournal() throws IOException {
        return findLatestJournal(journalsDir);
    }

    /** Most recently modified journal, or empty if the directory is missing or has none. */
    public static Optional<Path> findLatestJournal(Path dir) throws IOException {
        return listJournals(dir).stream()
                .max(Comparator.comparing(JournalRepository::modifiedTime)
                        .thenComparing(p -> p.getFileName().toString()));
    }

    public static String runIdOf(Path journal) {
        String name = journal.getFileName().toString();
        return name.endsWith(JOURNAL_SUFFIX)
                ? name.substring(0, name.length() - JOURNAL_SUFFIX.length())
                : name;
    }

    private static FileTime modifiedTime(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
