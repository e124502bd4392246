package com.trading.approval.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BoundsSeverity {
    SOFT,
    HARD;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static BoundsSeverity fromCode(String code) {
        return valueOf(code.toUpperCase());
    }
}
