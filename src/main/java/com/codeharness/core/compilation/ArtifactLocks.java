package com.codeharness.core.compilation;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per artifact path, so two compilation passes sharing an instance never write the same
 * artifact at once. An entry lives only while some thread holds or waits for its lock.
 */
public class ArtifactLocks {

    private final Map<Path, Entry> entries = new HashMap<>();

    /**
     * Blocks until {@code artifact} is free and takes it.
     *
     * @return a lease whose {@link Lease#close()} releases the lock; call it on the acquiring thread
     */
    public Lease acquire(Path artifact) throws InterruptedException {
        Path key = artifact.toAbsolutePath().normalize();
        Entry entry;
        synchronized (entries) {
            entry = entries.computeIfAbsent(key, k -> new Entry());
            entry.users++;
        }
        try {
            entry.lock.lockInterruptibly();
        } catch (InterruptedException e) {
            release(key, entry, false);
            throw e;
        }
        return () -> release(key, entry, true);
    }

    /** Number of artifacts currently locked or awaited. */
    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private void release(Path key, Entry entry, boolean locked) {
        synchronized (entries) {
            if (locked) {
                entry.lock.unlock();
            }
            if (--entry.users == 0) {
                entries.remove(key);
            }
        }
    }

    @FunctionalInterface
    public interface Lease extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
