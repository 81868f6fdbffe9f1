package com.libragraph.drive.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class KeyedLocksTest {

    @Test
    void shouldSerializeSameKey() throws Exception {
        KeyedLocks<String> locks = new KeyedLocks<>();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                futures.add(pool.submit(() -> locks.withLock("k", () -> {
                    int n = inside.incrementAndGet();
                    maxInside.accumulateAndGet(n, Math::max);
                    Thread.yield();
                    inside.decrementAndGet();
                })));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(locks.size()).isZero();
    }

    @Test
    void shouldNotBlockDifferentKeys() throws Exception {
        KeyedLocks<String> locks = new KeyedLocks<>();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread holder = new Thread(() -> locks.withLock("a", () -> {
            holding.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        holder.start();
        assertThat(holding.await(10, TimeUnit.SECONDS)).isTrue();

        String result = locks.withLock("b", () -> "done");
        assertThat(result).isEqualTo("done");
        assertThat(locks.size()).isEqualTo(1);

        release.countDown();
        holder.join(10_000);
        assertThat(locks.size()).isZero();
    }

    @Test
    void sharedHoldersShouldRunTogether() throws Exception {
        KeyedLocks<String> locks = new KeyedLocks<>();
        CountDownLatch both = new CountDownLatch(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(pool.submit(() -> locks.withSharedLock("k", () -> {
                    both.countDown();
                    try {
                        return both.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                })));
            }
            for (Future<Boolean> f : futures) {
                assertThat(f.get(15, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldReleaseOnException() {
        KeyedLocks<Integer> locks = new KeyedLocks<>();

        assertThatThrownBy(() -> locks.withLock(1, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.size()).isZero();
        assertThat(locks.withLock(1, () -> 7)).isEqualTo(7);
    }
}
