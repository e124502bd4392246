package com.trading.approval.model;

import java.util.Map;

/**
 * Compensating event a consumer should fire when an approval is revoked.
 */
public record Rollback(String event, Map<String, Object> params) {

    public Rollback {
        params = params == null ? Map.of() : params;
    }
}
