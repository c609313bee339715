package com.aceengine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * AcePaths — resolves every on-disk location the engine owns.
 *
 * Layout under the workspace root:
 *   .ace/journals/&lt;run_id&gt;.jsonl
 *   .ace/repairs/&lt;run_id&gt;-&lt;file&gt;.json
 *   .ace/learn.json
 *   .ace/index.json
 *
 * Nothing is created here. Each store creates its own directory on first write.
 */
@Component
public class AcePaths {

    private static final Logger log = LoggerFactory.getLogger(AcePaths.class);

    public static final String STATE_DIR_NAME = ".ace";

    private final Path workspaceRoot;

    public AcePaths(@Value("${ace.workspace.path:.}") String workspacePath) {
        this.workspaceRoot = Paths.get(workspacePath).toAbsolutePath().normalize();
        log.info("[AcePaths] Workspace root: {}", workspaceRoot);
    }

    public Path workspaceRoot() { return workspaceRoot; }
    public Path stateDir()      { return workspaceRoot.resolve(STATE_DIR_NAME); }
    public Path journalsDir()   { return stateDir().resolve("journals"); }
    public Path repairsDir()    { return stateDir().resolve("repairs"); }
    public Path learnFile()     { return stateDir().resolve("learn.json"); }
    public Path indexFile()     { return stateDir().resolve("index.json"); }

    /**
     * Path of a file relative to the workspace, with forward slashes.
     * Files outside the workspace are returned as absolute paths.
     */
    public String relativize(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(workspaceRoot)) {
            return absolute.toString();
        }
        return workspaceRoot.relativize(absolute).toString().replace('\\', '/');
    }

    @Override
    public String toString() {
        return "AcePaths{root=" + workspaceRoot + "}";
    }
}
