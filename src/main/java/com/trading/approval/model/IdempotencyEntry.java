package com.trading.approval.model;

public record IdempotencyEntry(String approvalKey, Decision decision, long recordedAt, long ttlMillis) {

    public boolean isExpired(long now) {
        return now - recordedAt >= ttlMillis;
    }
}
