package com.aceengine.core.repair;

import com.aceengine.core.guard.GuardResult;

import java.nio.file.Path;

/**
 * Oracle used by the repair search: may {@code after} replace {@code before}?
 */
@FunctionalInterface
public interface EditGuard {

    GuardResult check(Path file, String before, String after);
}
