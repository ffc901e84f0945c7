package com.anonrelay.ratelimit;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed set of lock stripes; work for the same key is always serialized.
 */
public class KeyedLocks {

    private final ReentrantLock[] stripes;

    public KeyedLocks(int stripeCount) {
        if (stripeCount < 1) throw new IllegalArgumentException("stripeCount must be positive");
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) stripes[i] = new ReentrantLock();
    }

    public <T> T withLock(long key, Supplier<T> action) {
        var lock = stripes[Math.floorMod(Long.hashCode(key), stripes.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
