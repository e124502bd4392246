package com.trading.approval.model;

import java.util.Map;

/**
 * A live approval whose action TTL is still running.
 */
public record ApprovalGrant(
        String approvalKey,
        String action,
        Map<String, Object> payload,
        long approvedAt,
        long ttlSeconds) {

    public long revokeDueAt() {
        return approvedAt + ttlSeconds * 1000L;
    }

    public boolean isDue(long now) {
        return now >= revokeDueAt();
    }
}
