package com.trading.approval.repository;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.model.Decision;
import com.trading.approval.model.IdempotencyEntry;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Approval key to its last terminal decision. A live entry is replayed instead of
 * re-running the gates, which is what keeps execution at most once per key.
 */
@Repository
public class IdempotencyCache {

    private final ApprovalGatewayConfig config;
    private final ConcurrentHashMap<String, IdempotencyEntry> entries = new ConcurrentHashMap<>();

    public IdempotencyCache(ApprovalGatewayConfig config) {
        this.config = config;
    }

    public Optional<Decision> findLive(String approvalKey, long now) {
        IdempotencyEntry entry = entries.get(approvalKey);
        if (entry == null || entry.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(entry.decision());
    }

    /**
     * Stores an Approved or Rejected decision under its key, replacing nothing that is still live.
     *
     * @throws IllegalArgumentException for Pending or Revoked decisions
     * @throws IllegalStateException if the key already holds a live decision
     */
    public IdempotencyEntry record(Decision decision, long now) {
        if (!decision.type().isCacheable()) {
            throw new IllegalArgumentException("Only terminal decisions are cached, got " + decision.type());
        }
        IdempotencyEntry entry = new IdempotencyEntry(decision.approvalKey(), decision, now,
                config.getIdempotencyTtlSeconds() * 1000L);
        IdempotencyEntry stored = entries.merge(decision.approvalKey(), entry,
                (existing, incoming) -> existing.isExpired(now) ? incoming : existing);
        if (stored != entry) {
            throw new IllegalStateException("Approval key " + decision.approvalKey() + " already has a live decision");
        }
        return entry;
    }

    public Optional<IdempotencyEntry> evict(String approvalKey) {
        return Optional.ofNullable(entries.remove(approvalKey));
    }

    /**
     * @return number of entries removed
     */
    public int evictExpired(long now) {
        int removed = 0;
        for (IdempotencyEntry entry : entries.values()) {
            // Conditional remove: a fresh decision recorded meanwhile must survive.
            if (entry.isExpired(now) && entries.remove(entry.approvalKey(), entry)) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }
}
