package com.company.alerting.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutex per key (fingerprint, service). Entries are reference counted
 * and removed once the last holder leaves, so the map only holds keys in use.
 */
public class KeyedLock {

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = acquire(key);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(key);
        }
    }

    int size() {
        return locks.size();
    }

    private Entry acquire(String key) {
        return locks.compute(key, (k, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.holders++;
            return e;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, e) -> --e.holders == 0 ? null : e);
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
