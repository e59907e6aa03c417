package com.everon.link.service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

/**
 * Serializes binding transitions per registration inside this process.
 *
 * Locks are striped by code hash: the same hash always maps to the same lock,
 * so two transitions on one record never interleave, while most transitions on
 * different records proceed in parallel.
 */
@Component
public class RecordLockRegistry {

    private static final int STRIPES = 256;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public RecordLockRegistry() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock(true);
        }
    }

    /**
     * Run an action while holding the lock for a code hash.
     */
    public <T> T withLock(String codeHash, Supplier<T> action) {
        ReentrantLock lock = lockFor(codeHash);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String codeHash) {
        return locks[Math.floorMod(codeHash.hashCode(), STRIPES)];
    }
}
