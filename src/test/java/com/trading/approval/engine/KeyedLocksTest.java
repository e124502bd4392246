package com.trading.approval.engine;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyedLocksTest {

    private final KeyedLocks locks = new KeyedLocks();

    @Test
    void withLock_returnsSupplierValueAndReleasesKey() {
        String value = locks.withLock("k1", () -> "done");

        assertThat(value).isEqualTo("done");
        assertThat(locks.activeKeys()).isZero();
    }

    @Test
    void withLock_exceptionStillReleasesKey() {
        assertThatThrownBy(() -> locks.withLock("k1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.activeKeys()).isZero();
    }

    @Test
    void withLock_isReentrantForSameThread() {
        int value = locks.withLock("k1", () -> locks.withLock("k1", () -> 42));

        assertThat(value).isEqualTo(42);
        assertThat(locks.activeKeys()).isZero();
    }

    @Test
    void sameKey_neverRunsConcurrently() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < 8; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int j = 0; j < 50; j++) {
                    locks.withLock("shared", () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        return inside.decrementAndGet();
                    });
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(locks.activeKeys()).isZero();
    }

    @Test
    void distinctKeys_doNotBlockEachOther() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();

        Future<Boolean> holder = pool.submit(() -> locks.withLock("a", () -> {
            holding.countDown();
            try {
                return release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }));
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

        String other = locks.withLock("b", () -> "free");
        assertThat(other).isEqualTo("free");
        assertThat(locks.activeKeys()).isEqualTo(1);

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        pool.shutdown();
        assertThat(locks.activeKeys()).isZero();
    }
}
