package com.trading.approval.model;

/**
 * Decision variants and the outbound topic each one is published on.
 */
public enum DecisionType {
    APPROVED("action.approved"),
    REJECTED("action.rejected"),
    PENDING("approval.pending"),
    REVOKED("approval.revoked");

    private final String topic;

    DecisionType(String topic) {
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }

    public boolean isCacheable() {
        return this == APPROVED || this == REJECTED;
    }
}
