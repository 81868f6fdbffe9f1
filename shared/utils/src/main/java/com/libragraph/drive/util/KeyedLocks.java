package com.libragraph.drive.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Per-key read/write locks.
 *
 * <p>Work on different keys never contends. Entries are reference-counted and removed
 * once no thread holds or waits on them, so the map only grows with live contention.
 * Exclusive sections use {@link #withLock}, shared sections {@link #withSharedLock}.
 */
public final class KeyedLocks<K> {

    private static final class Entry {
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        int users;
    }

    private final ConcurrentHashMap<K, Entry> entries = new ConcurrentHashMap<>();

    public <T> T withLock(K key, Supplier<T> action) {
        return run(key, false, action);
    }

    public void withLock(K key, Runnable action) {
        run(key, false, () -> {
            action.run();
            return null;
        });
    }

    public <T> T withSharedLock(K key, Supplier<T> action) {
        return run(key, true, action);
    }

    /**
     * Keys currently held or awaited.
     */
    public int size() {
        return entries.size();
    }

    private <T> T run(K key, boolean shared, Supplier<T> action) {
        Entry entry = acquireEntry(key);
        Lock lock = shared ? entry.lock.readLock() : entry.lock.writeLock();
        try {
            lock.lock();
            try {
                return action.get();
            } finally {
                lock.unlock();
            }
        } finally {
            releaseEntry(key);
        }
    }

    private Entry acquireEntry(K key) {
        return entries.compute(key, (k, e) -> {
            Entry entry = e != null ? e : new Entry();
            entry.users++;
            return entry;
        });
    }

    private void releaseEntry(K key) {
        entries.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }
}
