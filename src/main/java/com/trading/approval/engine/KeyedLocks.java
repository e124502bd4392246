package com.trading.approval.engine;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-approval-key mutual exclusion. Locks are fair so submissions for one key are served
 * in arrival order, and reference counted so a key's lock disappears once nobody holds or
 * waits for it. Distinct keys never share a lock.
 */
@Component
public class KeyedLocks {

    private final ConcurrentHashMap<String, Holder> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        Holder holder = locks.compute(key, (k, existing) -> {
            Holder h = existing != null ? existing : new Holder();
            h.references++;
            return h;
        });

        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            locks.computeIfPresent(key, (k, h) -> --h.references == 0 ? null : h);
        }
    }

    /** Keys currently held or awaited. Published as the {@code approval.locks.active} gauge. */
    public int activeKeys() {
        return locks.size();
    }

    private static final class Holder {
        // Guarded by the map's per-bin compute.
        private int references;
        private final ReentrantLock lock = new ReentrantLock(true);
    }
}
