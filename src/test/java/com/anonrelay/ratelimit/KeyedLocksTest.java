package com.anonrelay.ratelimit;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeyedLocksTest {

    @Test
    void serializesWorkOnSameKey() throws Exception {
        var locks = new KeyedLocks(4);
        var inside = new AtomicInteger();
        var maxInside = new AtomicInteger();
        var done = new CountDownLatch(20);
        var pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 20; i++) {
            pool.execute(() -> {
                locks.withLock(7L, () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    Thread.yield();
                    inside.decrementAndGet();
                    return null;
                });
                done.countDown();
            });
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(1, maxInside.get());
    }

    @Test
    void returnsSupplierResultAndReleasesOnFailure() {
        var locks = new KeyedLocks(2);
        assertEquals("ok", locks.withLock(1L, () -> "ok"));
        assertThrows(IllegalStateException.class, () -> locks.withLock(1L, () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals("again", locks.withLock(1L, () -> "again"));
    }
}
