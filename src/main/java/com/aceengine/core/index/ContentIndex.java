package com.aceengine.core.index;

import com.aceengine.config.AcePaths;
import com.aceengine.config.JsonMappers;
import com.aceengine.core.filesystem.AtomicFileWriter;
import com.aceengine.core.filesystem.ContentHasher;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * ContentIndex — per-file SHA-256 fingerprint cache for incremental runs.
 *
 * Persisted at .ace/index.json as {"entries": {"/abs/path": {size, sha256, clean_runs_count}}}.
 * Keys are absolute, normalized paths.
 *
 * has_changed() is a pure query: it never touches stored entries.
 * save() is write-temp-then-rename, so a failed save leaves the previous file intact.
 * A corrupted or unreadable index.json loads as an empty index.
 */
@Component
public class ContentIndex {

    private static final Logger log = LoggerFactory.getLogger(ContentIndex.class);

    private final Path         indexPath;
    private final ObjectMapper mapper;

    private final Map<String, IndexEntry> entries = new TreeMap<>();
    private boolean loaded = false;

    @Autowired
    public ContentIndex(AcePaths paths) {
        this(paths.indexFile());
    }

    public ContentIndex(Path indexPath) {
        this.indexPath = indexPath;
        this.mapper    = JsonMappers.sorted();
    }

    // ================================================================
    // Persistence
    // ================================================================

    public synchronized void load() {
        loaded = true;
        entries.clear();
        if (!Files.exists(indexPath)) {
            return;
        }
        try {
            IndexDocument doc = mapper.readValue(indexPath.toFile(), IndexDocument.class);
            if (doc.entries != null) {
                for (Map.Entry<String, IndexEntry> e : doc.entries.entrySet()) {
                    if (e.getValue() == null || e.getValue().getSha256() == null) {
                        throw new IOException("Malformed entry for " + e.getKey());
                    }
                    entries.put(e.getKey(), e.getValue().withPath(e.getKey()));
                }
            }
            log.info("[ContentIndex] Loaded {} entries from {}", entries.size(), indexPath);
        } catch (IOException e) {
            log.warn("[ContentIndex] Index at {} is unreadable, starting empty: {}",
                    indexPath, e.getMessage());
            entries.clear();
        }
    }

    public synchronized void save() throws IOException {
        ensureLoaded();
        IndexDocument doc = new IndexDocument();
        doc.entries.putAll(entries);
        String json = JsonMappers.documentWriter(mapper).writeValueAsString(doc) + "\n";
        AtomicFileWriter.write(indexPath, json.getBytes(StandardCharsets.UTF_8));
        log.debug("[ContentIndex] Saved {} entries to {}", entries.size(), indexPath);
    }

    // ================================================================
    // Mutations
    // ================================================================

    public IndexEntry addFile(Path file) throws IOException {
        return addFile(file, false);
    }

    /**
     * Computes size and hash of {@code file} and stores the entry.
     *
     * @param preserveCleanRuns keep the existing clean-run count, but only when the
     *                          content hash is unchanged; any content change resets it
     */
    public synchronized IndexEntry addFile(Path file, boolean preserveCleanRuns) throws IOException {
        ensureLoaded();
        String key  = key(file);
        byte[] data = Files.readAllBytes(file);
        String sha  = ContentHasher.sha256(data);

        int cleanRuns = 0;
        IndexEntry previous = entries.get(key);
        if (preserveCleanRuns && previous != null && previous.getSha256().equals(sha)) {
            cleanRuns = previous.getCleanRunsCount();
        }

        IndexEntry entry = new IndexEntry(key, data.length, sha, cleanRuns);
        entries.put(key, entry);
        return entry;
    }

    public synchronized void incrementCleanRuns(Path file) {
        ensureLoaded();
        IndexEntry entry = entries.get(key(file));
        if (entry != null) {
            entry.incrementCleanRuns();
        }
    }

    public synchronized void resetCleanRuns(Path file) {
        ensureLoaded();
        IndexEntry entry = entries.get(key(file));
        if (entry != null) {
            entry.resetCleanRuns();
        }
    }

    public synchronized void removeFile(Path file) {
        ensureLoaded();
        entries.remove(key(file));
    }

    /** Drops every entry and indexes {@code files} from scratch; unreadable files are skipped. */
    public synchronized void rebuild(Collection<Path> files) {
        ensureLoaded();
        entries.clear();
        for (Path file : files) {
            try {
                addFile(file);
            } catch (IOException e) {
                log.warn("[ContentIndex] Skipping unreadable file during rebuild: {}", file);
            }
        }
    }

    // ================================================================
    // Queries
    // ================================================================

    public synchronized boolean hasChanged(Path file) {
        ensureLoaded();
        IndexEntry entry = entries.get(key(file));
        if (entry == null) return true;
        if (!Files.isRegularFile(file)) return true;
        try {
            if (Files.size(file) != entry.getSize()) return true;
            return !ContentHasher.sha256(file).equals(entry.getSha256());
        } catch (IOException e) {
            return true;
        }
    }

    public List<Path> getChangedFiles(Collection<Path> files) {
        List<Path> changed = new ArrayList<>();
        for (Path file : files) {
            if (hasChanged(file)) changed.add(file);
        }
        return changed;
    }

    public synchronized boolean shouldSkipDeepScan(Path file, int threshold) {
        ensureLoaded();
        IndexEntry entry = entries.get(key(file));
        return entry != null && entry.getCleanRunsCount() >= threshold;
    }

    public synchronized Optional<IndexEntry> getEntry(Path file) {
        ensureLoaded();
        return Optional.ofNullable(entries.get(key(file)));
    }

    public synchronized Map<String, Long> getStats() {
        ensureLoaded();
        long totalSize  = 0;
        long cleanFiles = 0;
        for (IndexEntry entry : entries.values()) {
            totalSize += entry.getSize();
            if (entry.getCleanRunsCount() > 0) cleanFiles++;
        }
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("total_files", (long) entries.size());
        stats.put("total_size", totalSize);
        stats.put("clean_files", cleanFiles);
        return stats;
    }

    public Path getIndexPath() {
        return indexPath;
    }

    /** The index loads itself on first use so a partial in-memory view never overwrites the file. */
    private void ensureLoaded() {
        if (!loaded) {
            load();
        }
    }

    private static String key(Path file) {
        return file.toAbsolutePath().normalize().toString();
    }

    static final class IndexDocument {
        @JsonProperty("entries")
        Map<String, IndexEntry> entries = new TreeMap<>();
    }
}
