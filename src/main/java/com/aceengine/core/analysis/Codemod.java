package com.aceengine.core.analysis;

import com.aceengine.core.edit.EditPlan;
import com.aceengine.core.edit.Finding;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns findings for a file into edit plans. The engine never asks why an edit is
 * proposed, only whether it is safe to commit.
 */
@FunctionalInterface
public interface Codemod {

    List<EditPlan> plan(Path file, String content, List<Finding> findings);
}
