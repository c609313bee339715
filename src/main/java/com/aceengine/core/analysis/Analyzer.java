package com.aceengine.core.analysis;

import com.aceengine.core.edit.Finding;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Produces findings for one file. Implementations run on analysis worker threads
 * and must not touch the journal, learning data or the index.
 */
@FunctionalInterface
public interface Analyzer {

    List<Finding> analyze(Path file) throws IOException;
}
