package com.aceengine.core.filesystem;

import com.aceengine.config.AcePaths;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileSystemManagerTest {

    @TempDir
    Path tempDir;

    private FileSystemManager fileSystem;

    @BeforeEach
    void setUp() {
        fileSystem = new FileSystemManager(new AcePaths(tempDir.toString()));
    }

    @Test
    void testAtomicWriteAndRead() throws Exception {
        String content = "def calculate(a, b):\n    return a + b\n";

        fileSystem.atomicWrite("pkg/calculator.py", content.getBytes(StandardCharsets.UTF_8));

        assertEquals(content, fileSystem.readString("pkg/calculator.py"));
        assertTrue(Files.exists(tempDir.resolve("pkg/calculator.py")));
    }

    @Test
    void testAtomicWriteLeavesNoTempFiles() throws Exception {
        fileSystem.atomicWrite("a.txt", "first".getBytes(StandardCharsets.UTF_8));
        fileSystem.atomicWrite("a.txt", "second".getBytes(StandardCharsets.UTF_8));

        assertEquals("second", fileSystem.readString("a.txt"));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of("a.txt"),
                    files.map(p -> p.getFileName().toString()).collect(Collectors.toList()));
        }
    }

    @Test
    void testFailedAtomicWriteLeavesTargetAndNoTempFile() throws Exception {
        Path target = tempDir.resolve("module.py");
        Files.createDirectories(target);
        Files.writeString(target.resolve("keep.txt"), "kept");

        assertThrows(FileSystemManager.FileSystemException.class,
                () -> fileSystem.atomicWrite("module.py", "x = 1\n".getBytes(StandardCharsets.UTF_8)));

        assertTrue(Files.isDirectory(target));
        assertEquals("kept", Files.readString(target.resolve("keep.txt")));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of("module.py"),
                    files.map(p -> p.getFileName().toString()).collect(Collectors.toList()));
        }
    }

    @Test
    void testAtomicWriteKeepsPosixPermissions() throws Exception {
        assumeTrue(Files.getFileStore(tempDir).supportsFileAttributeView(PosixFileAttributeView.class));
        Path script = tempDir.resolve("run.py");
        Files.writeString(script, "print('old')\n");
        Set<PosixFilePermission> executable = PosixFilePermissions.fromString("rwxr-xr-x");
        Files.setPosixFilePermissions(script, executable);

        fileSystem.atomicWrite("run.py", "print('new')\n".getBytes(StandardCharsets.UTF_8));
        fileSystem.atomicWrite("fresh.py", "x = 1\n".getBytes(StandardCharsets.UTF_8));

        assertEquals("print('new')\n", Files.readString(script));
        assertEquals(executable, Files.getPosixFilePermissions(script));
        assertEquals(AtomicFileWriter.NEW_FILE_PERMISSIONS,
                Files.getPosixFilePermissions(tempDir.resolve("fresh.py")));
    }

    @Test
    void testPathTraversalPrevention() {
        assertThrows(
            FileSystemManager.FileSystemException.class,
            () -> fileSystem.readBytes("../../etc/passwd")
        );
        assertThrows(
            FileSystemManager.FileSystemException.class,
            () -> fileSystem.atomicWrite("../escape.txt", new byte[0])
        );
    }

    @Test
    void testSha256MatchesContentHasher() throws Exception {
        Files.writeString(tempDir.resolve("x.py"), "x = 1\n");

        assertEquals(ContentHasher.sha256("x = 1\n"), fileSystem.sha256("x.py"));
    }

    @Test
    void testFileExists() throws Exception {
        Files.writeString(tempDir.resolve("exists.txt"), "test");

        assertTrue(fileSystem.fileExists("exists.txt"));
        assertFalse(fileSystem.fileExists("missing.txt"));
        assertFalse(fileSystem.fileExists("../outside.txt"));
    }

    @Test
    void testListIndexableFilesSkipsHiddenAndBinary() throws Exception {
        Files.writeString(tempDir.resolve("b.py"), "b = 2\n");
        Files.writeString(tempDir.resolve("a.py"), "a = 1\n");
        Files.writeString(tempDir.resolve(".hidden.py"), "h = 0\n");
        Files.write(tempDir.resolve("image.png"), new byte[]{1, 2, 3});
        Files.createDirectories(tempDir.resolve(".ace"));
        Files.writeString(tempDir.resolve(".ace/index.json"), "{}");

        List<Path> files = fileSystem.listIndexableFiles(".");

        assertEquals(2, files.size());
        assertEquals("a.py", files.get(0).getFileName().toString());
        assertEquals("b.py", files.get(1).getFileName().toString());
    }
}
