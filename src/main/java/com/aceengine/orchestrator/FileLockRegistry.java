package com.aceengine.orchestrator;

import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per absolute path. Every write to a workspace file happens while
 * holding that file's lock, so two commit workers never write the same path.
 */
@Component
public class FileLockRegistry {

    private final ConcurrentMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(Path file) {
        return locks.computeIfAbsent(file.toAbsolutePath().normalize(), p -> new ReentrantLock());
    }

    public int size() {
        return locks.size();
    }
}
