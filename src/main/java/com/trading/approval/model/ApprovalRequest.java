package com.trading.approval.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Normalized form of both inbound approval topics.
 */
@Value
@Builder
public class ApprovalRequest {
    String approvalKey;
    String action;
    Map<String, Object> payload;
    Requester requester;
    String reason;
    Long ttlOverrideSeconds;   // null keeps the profile TTL
    RequestSource source;

    public Map<String, Object> getPayload() {
        return payload == null ? Map.of() : payload;
    }
}
