package com.aceengine.core.repair;

import com.aceengine.config.AcePaths;
import com.aceengine.config.JsonMappers;
import com.aceengine.core.filesystem.AtomicFileWriter;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Persists repair reports as {@code .ace/repairs/<run_id>-<file>.json}.
 *
 * Path separators in the file name are replaced with '_' so reports for
 * same-named files in different directories do not collide.
 */
@Component
public class RepairReportStore {

    private static final Logger log = LoggerFactory.getLogger(RepairReportStore.class);

    private final Path         repairsDir;
    private final ObjectMapper mapper;

    @Autowired
    public RepairReportStore(AcePaths paths) {
        this(paths.repairsDir());
    }

    public RepairReportStore(Path repairsDir) {
        this.repairsDir = repairsDir;
        this.mapper     = JsonMappers.sorted();
    }

    public Path write(RepairReport report) throws IOException {
        Path target = repairsDir.resolve(fileNameFor(report.getRunId(), report.getFile()));
        String json = JsonMappers.documentWriter(mapper).writeValueAsString(report) + "\n";
        AtomicFileWriter.write(target, json.getBytes(StandardCharsets.UTF_8));
        log.info("[RepairReportStore] Wrote repair report {}", target.getFileName());
        return target;
    }

    public RepairReport read(Path reportFile) throws IOException {
        return mapper.readValue(reportFile.toFile(), RepairReport.class);
    }

    /** Most recently modified report, or empty when none exist. */
    public Optional<RepairReport> readLatest() throws IOException {
        if (!Files.isDirectory(repairsDir)) {
            return Optional.empty();
        }
        Optional<Path> latest;
        try (Stream<Path> files = Files.list(repairsDir)) {
            latest = files
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .max(Comparator.comparing(RepairReportStore::modifiedTime)
                            .thenComparing(p -> p.getFileName().toString()));
        }
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(read(latest.get()));
    }

    public Path getRepairsDir() {
        return repairsDir;
    }

    static String fileNameFor(String runId, String file) {
        String flattened = file.replace('\\', '/');
        while (flattened.startsWith("/")) {
            flattened = flattened.substring(1);
        }
        flattened = flattened.replace('/', '_').replace(':', '_');
        return runId + "-" + flattened + ".json";
    }

    private static FileTime modifiedTime(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
