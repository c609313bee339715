package com.aceengine.core.receipt;

import com.aceengine.config.AcePaths;
import com.aceengine.config.JsonMappers;
import com.aceengine.config.Timestamps;
import com.aceengine.core.filesystem.ContentHasher;
import com.aceengine.core.journal.JournalRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * ReceiptStore — creates receipts and checks them against the workspace.
 *
 * A receipt's after_hash must equal the file's hash right after the apply.
 * Any later mismatch is reported as an integrity failure and never corrected here.
 */
@Component
public class ReceiptStore {

    private static final Logger log = LoggerFactory.getLogger(ReceiptStore.class);

    private static final int RECEIPT_ID_LENGTH = 16;

    private final Clock        clock;
    private final ObjectMapper mapper;

    public ReceiptStore(Clock clock) {
        this.clock  = clock;
        this.mapper = JsonMappers.sorted();
    }

    // ================================================================
    // Creation
    // ================================================================

    public Receipt createReceipt(String planId, String file, String beforeContent, String afterContent,
                                 boolean parseValid, boolean invariantsMet,
                                 double estimatedRisk, long durationMs) {
        return createReceipt(planId, file, beforeContent, afterContent, parseValid, invariantsMet,
                estimatedRisk, durationMs, "");
    }

    public Receipt createReceipt(String planId, String file, String beforeContent, String afterContent,
                                 boolean parseValid, boolean invariantsMet,
                                 double estimatedRisk, long durationMs, String policyHash) {
        return new Receipt(
                planId,
                file,
                ContentHasher.stripPrefix(ContentHasher.sha256(beforeContent)),
                ContentHasher.stripPrefix(ContentHasher.sha256(afterContent)),
                parseValid,
                invariantsMet,
                estimatedRisk,
                durationMs,
                Timestamps.now(clock),
                policyHash);
    }

    /** First 16 hex chars of sha256(plan_id + ":" + file + ":" + after_hash). */
    public static String receiptId(Receipt receipt) {
        String material = receipt.getPlanId() + ":" + receipt.getFile() + ":" + receipt.getAfterHash();
        return ContentHasher.shortHash(ContentHasher.sha256(material), RECEIPT_ID_LENGTH);
    }

    // ================================================================
    // Verification
    // ================================================================

    public static boolean verifyReceipt(Receipt receipt, String currentContent) {
        return ContentHasher.sha256(currentContent).equals(ContentHasher.stripPrefix(receipt.getAfterHash()));
    }

    public static boolean verifyReceipt(Receipt receipt, byte[] currentBytes) {
        return ContentHasher.sha256(currentBytes).equals(ContentHasher.stripPrefix(receipt.getAfterHash()));
    }

    public static boolean isIdempotentTransformation(String beforeContent, String afterContent) {
        return ContentHasher.sha256(beforeContent).equals(ContentHasher.sha256(afterContent));
    }

    public List<String> verifyReceipts(AcePaths paths) {
        return verifyReceipts(paths.workspaceRoot());
    }

    /**
     * Checks every receipt embedded in {@code .ace/journals/*.jsonl} under {@code root}
     * against the file it names (resolved against {@code root}).
     *
     * @return one message per failure; empty when everything matches or there are no journals
     */
    public List<String> verifyReceipts(Path root) {
        Path journalsDir = root.resolve(AcePaths.STATE_DIR_NAME).resolve("journals");
        List<String> failures = new ArrayList<>();

        List<Path> journals;
        try {
            journals = JournalRepository.listJournals(journalsDir);
        } catch (IOException e) {
            failures.add(journalsDir.getFileName() + " - Cannot read journal: " + e.getMessage());
            return failures;
        }

        for (Path journal : journals) {
            String name = journal.getFileName().toString();
            try (BufferedReader reader = Files.newBufferedReader(journal, StandardCharsets.UTF_8)) {
                String line;
                int    lineNo = 0;
                while ((line = reader.readLine()) != null) {
                    lineNo++;
                    if (line.isBlank()) continue;
                    String failure = checkLine(root, name, lineNo, line);
                    if (failure != null) failures.add(failure);
                }
            } catch (IOException e) {
                failures.add(name + " - Cannot read journal: " + e.getMessage());
            }
        }

        if (failures.isEmpty()) {
            log.info("[ReceiptStore] Verified receipts in {} journal(s): OK", journals.size());
        } else {
            log.warn("[ReceiptStore] {} integrity failure(s) found", failures.size());
        }
        return failures;
    }

    private String checkLine(Path root, String journalName, int lineNo, String line) {
        String where = journalName + ":" + lineNo + " - ";

        JsonNode entry;
        try {
            entry = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            return where + "Invalid JSON";
        }
        if (!"success".equals(entry.path("type").asText()) || !entry.hasNonNull("receipt")) {
            return null;
        }

        Receipt receipt;
        try {
            receipt = mapper.treeToValue(entry.get("receipt"), Receipt.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return where + "Invalid receipt: " + e.getMessage();
        }

        Path file = root.resolve(receipt.getFile());
        if (!Files.exists(file)) {
            return where + "File no longer exists: " + receipt.getFile();
        }
        try {
            if (!verifyReceipt(receipt, Files.readAllBytes(file))) {
                return where + "Hash mismatch for " + receipt.getFile()
                        + " (expected " + ContentHasher.shortHash(receipt.getAfterHash(), 8) + "...)";
            }
        } catch (IOException e) {
            return where + "Cannot read " + receipt.getFile() + ": " + e.getMessage();
        }
        return null;
    }
}
