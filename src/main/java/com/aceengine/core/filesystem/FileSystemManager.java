package com.aceengine.core.filesystem;

import com.aceengine.config.AcePaths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Workspace-scoped file access for the committing path.
 *
 * All reads are raw bytes so hashes match what is on disk. All writes go through
 * {@link AtomicFileWriter}. Paths are resolved against the workspace root and
 * anything escaping it is rejected.
 */
@Component
public class FileSystemManager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemManager.class);

    static final long MAX_INDEXABLE_SIZE = 10L * 1024 * 1024;

    private static final Set<String> BINARY_EXTENSIONS = Set.of(
            ".pyc", ".pyo", ".so", ".dylib", ".dll", ".exe", ".bin",
            ".jpg", ".jpeg", ".png", ".gif", ".pdf", ".zip", ".tar", ".gz", ".bz2"
    );

    private static final Set<String> IGNORED_DIRECTORIES = Set.of(
            "__pycache__", "node_modules"
    );

    private final AcePaths paths;
    private final Path     workspaceRoot;

    public FileSystemManager(AcePaths paths) {
        this.paths         = paths;
        this.workspaceRoot = paths.workspaceRoot();
        log.info("[FileSystem] Workspace: {}", workspaceRoot);
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public AcePaths getPaths() {
        return paths;
    }

    // ================================================================
    // Reads
    // ================================================================

    public byte[] readBytes(String relativePath) throws FileSystemException {
        Path target = resolveSafePath(relativePath);
        try {
            return Files.readAllBytes(target);
        } catch (IOException e) {
            throw new FileSystemException("Failed to read file: " + relativePath, e);
        }
    }

    public String readString(String relativePath) throws FileSystemException {
        return new String(readBytes(relativePath), StandardCharsets.UTF_8);
    }

    public String sha256(String relativePath) throws FileSystemException {
        return ContentHasher.sha256(readBytes(relativePath));
    }

    public boolean fileExists(String relativePath) {
        try { return Files.isRegularFile(resolveSafePath(relativePath)); }
        catch (FileSystemException e) { return false; }
    }

    // ================================================================
    // Writes
    // ================================================================

    /**
     * Replaces the file atomically. On failure the previous content is untouched.
     */
    public void atomicWrite(String relativePath, byte[] content) throws FileSystemException {
        Path target = resolveSafePath(relativePath);
        log.info("[FileSystem] Atomic write of {} bytes to {}", content.length, relativePath);
        try {
            AtomicFileWriter.write(target, content);
        } catch (IOException e) {
            throw new FileSystemException("Failed to write file: " + relativePath, e);
        }
    }

    // ================================================================
    // Enumeration
    // ================================================================

    /**
     * All indexable regular files under {@code relativeDir}, sorted by path.
     */
    public List<Path> listIndexableFiles(String relativeDir) throws FileSystemException {
        Path dir = resolveSafePath(relativeDir);
        if (Files.isRegularFile(dir)) {
            return isIndexable(dir) ? List.of(dir) : List.of();
        }
        if (!Files.isDirectory(dir)) {
            throw new FileSystemException("Not a directory: " + relativeDir);
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                       .filter(p -> !isInIgnoredDirectory(dir.relativize(p)))
                       .filter(FileSystemManager::isIndexable)
                       .sorted()
                       .collect(Collectors.toList());
        } catch (IOException e) {
            throw new FileSystemException("Failed to enumerate: " + relativeDir, e);
        }
    }

    /**
     * Hidden files, known binary extensions and files over 10 MiB are not indexed.
     */
    public static boolean isIndexable(Path file) {
        String name = file.getFileName().toString();
        if (name.startsWith(".")) return false;

        int dot = name.lastIndexOf('.');
        if (dot >= 0 && BINARY_EXTENSIONS.contains(name.substring(dot).toLowerCase(Locale.ROOT))) {
            return false;
        }

        if (Files.exists(file)) {
            try {
                return Files.size(file) <= MAX_INDEXABLE_SIZE;
            } catch (IOException e) {
                return false;
            }
        }
        return true;
    }

    // ================================================================
    // Private helpers
    // ================================================================

    public Path resolveSafePath(String relativePath) throws FileSystemException {
        if (relativePath == null || relativePath.trim().isEmpty())
            throw new FileSystemException("Path cannot be empty");
        Path resolved = workspaceRoot.resolve(relativePath).normalize();
        if (!resolved.startsWith(workspaceRoot))
            throw new FileSystemException("Path traversal attempt detected: " + relativePath);
        return resolved;
    }

    private boolean isInIgnoredDirectory(Path relative) {
        Path parent = relative.getParent();
        if (parent == null) return false;
        for (Path part : parent) {
            String name = part.toString();
            if (name.startsWith(".") || IGNORED_DIRECTORIES.contains(name)) return true;
        }
        return false;
    }

    // ================================================================
    // Exception
    // ================================================================

    public static class FileSystemException extends Exception {
        public FileSystemException(String message)                  { super(message); }
        public FileSystemException(String message, Throwable cause) { super(message, cause); }
    }
}
