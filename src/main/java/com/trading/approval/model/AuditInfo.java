package com.trading.approval.model;

import java.util.UUID;

public record AuditInfo(String eventId, String producedBy, long producedAt) {

    public static final String PRODUCER = "action-approval-gateway";

    public static AuditInfo at(long producedAt) {
        return new AuditInfo(UUID.randomUUID().toString(), PRODUCER, producedAt);
    }
}
