package com.trading.approval.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertLevel {
    INFO,
    WARN,
    ERROR,
    CRITICAL;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    public boolean isAtLeast(AlertLevel threshold) {
        return threshold == null || compareTo(threshold) >= 0;
    }
}
