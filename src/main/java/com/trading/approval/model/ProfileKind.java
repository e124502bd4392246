package com.trading.approval.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProfileKind {
    SINGLE("single"),
    DUAL("dual"),
    QUORUM("quorum");

    private final String code;

    ProfileKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ProfileKind fromCode(String code) {
        for (ProfileKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code) || kind.name().equalsIgnoreCase(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown approval profile kind: " + code);
    }
}
