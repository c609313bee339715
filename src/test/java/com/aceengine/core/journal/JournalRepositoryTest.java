package com.aceengine.core.journal;

import com.aceengine.config.AcePaths;
import com.aceengine.core.filesystem.ContentHasher;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JournalRepositoryTest {

    @TempDir
    Path tempDir;

    private JournalRepository repository;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-31T12:00:00Z"), ZoneOffset.UTC);
        repository = new JournalRepository(new AcePaths(tempDir.toString()), clock);
    }

    @Test
    void testEntriesAreWrittenAsJsonLines() throws Exception {
        try (Journal journal = repository.open("run-1")) {
            journal.logIntent("a.py", "aaa", 10, List.of("rule-b", "rule-a"), "plan-1", "x = 1\n", "ctx");
            journal.logSuccess("a.py", "bbb", 12, "receipt-1");
        }

        List<String> lines = Files.readAllLines(repository.pathFor("run-1"));
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"type\":\"intent\""));
        assertTrue(lines.get(0).contains("\"rule_ids\":[\"rule-a\",\"rule-b\"]"));
        assertTrue(lines.get(0).contains("\"timestamp\":\"2025-01-31T12:00:00.000Z\""));
        assertTrue(lines.get(1).contains("\"type\":\"success\""));
    }

    @Test
    void testReadJournalRoundTripsEntryTypes() throws Exception {
        try (Journal journal = repository.open("run-1")) {
            journal.logIntent("a.py", "aaa", 10, List.of("r"), "plan-1", "x = 1\n");
            journal.logSuccess("a.py", "bbb", 12, "receipt-1");
            journal.logRevert("a.py", "bbb", "aaa", "manual");
        }

        List<JournalEntry> entries = repository.readJournal(repository.pathFor("run-1"));

        assertEquals(3, entries.size());
        IntentEntry intent = assertInstanceOf(IntentEntry.class, entries.get(0));
        assertEquals("x = 1\n", intent.getPreImage());
        assertNull(intent.getContextKey());
        assertEquals("receipt-1", assertInstanceOf(SuccessEntry.class, entries.get(1)).getReceiptId());
        assertEquals("manual", assertInstanceOf(RevertEntry.class, entries.get(2)).getReason());
    }

    @Test
    void testClosedJournalRejectsWrites() throws Exception {
        Journal journal = repository.open("run-1");
        journal.close();
        journal.close();

        assertTrue(journal.isClosed());
        assertThrows(IllegalStateException.class,
                () -> journal.logRevert("a.py", "x", "y", "late"));
    }

    @Test
    void testClosedJournalIsNeverReopened() throws Exception {
        try (Journal journal = repository.open("run-1")) {
            journal.logIntent("a.py", "aaa", 10, List.of("r"), "plan-1", "x = 1\n");
        }
        List<String> written = Files.readAllLines(repository.pathFor("run-1"));

        assertThrows(FileAlreadyExistsException.class, () -> repository.open("run-1"));
        assertEquals(written, Files.readAllLines(repository.pathFor("run-1")));
    }

    @Test
    void testRevertPlanPairsIntentWithSuccess() throws Exception {
        String before = "x = 1\n";
        try (Journal journal = repository.open("run-1")) {
            journal.logIntent("a.py", ContentHasher.sha256(before), 6, List.of("r1"), "plan-1", before, "ctx-a");
            journal.logSuccess("a.py", "after-a", 7, "rc-a");
            journal.logIntent("b.py", "before-b", 6, List.of("r2"), "plan-2", "y = 1\n");
            journal.logIntent("c.py", "before-c", 6, List.of("r3"), "plan-3", "z = 1\n");
            journal.logSuccess("c.py", "after-c", 7, "rc-c");
        }

        List<RevertContext> plan = repository.buildRevertPlan(repository.pathFor("run-1"));

        assertEquals(2, plan.size());
        RevertContext first = plan.get(0);
        assertEquals("a.py", first.getFile());
        assertEquals("after-a", first.getExpectedCurrentSha());
        assertEquals(ContentHasher.sha256(before), first.getOriginalSha());
        assertEquals(before, first.getRestoreContent());
        assertEquals("plan-1", first.getPlanId());
        assertEquals(List.of("r1"), first.getRuleIds());
        assertEquals("ctx-a", first.getContextKey());
        assertEquals("c.py", plan.get(1).getFile());
    }

    @Test
    void testMissingJournalIsEmpty() throws Exception {
        assertTrue(repository.readJournal(repository.pathFor("nope")).isEmpty());
        assertTrue(repository.listJournals().isEmpty());
        assertTrue(repository.findLatestJournal().isEmpty());
    }

    @Test
    void testCorruptLineIsReported() throws Exception {
        Files.createDirectories(repository.getJournalsDir());
        Files.writeString(repository.pathFor("bad"), "{\"type\":\"intent\"\n");

        IOException e = assertThrows(IOException.class,
                () -> repository.readJournal(repository.pathFor("bad")));
        assertTrue(e.getMessage().startsWith("bad.jsonl:1"));
    }

    @Test
    void testLatestJournalByModificationTime() throws Exception {
        repository.open("run-b").close();
        repository.open("run-a").close();
        Files.setLastModifiedTime(repository.pathFor("run-b"), FileTime.fromMillis(1_000));
        Files.setLastModifiedTime(repository.pathFor("run-a"), FileTime.fromMillis(2_000));

        assertEquals(List.of(repository.pathFor("run-a"), repository.pathFor("run-b")),
                repository.listJournals());
        assertEquals("run-a", JournalRepository.runIdOf(repository.findLatestJournal().orElseThrow()));
    }
}
