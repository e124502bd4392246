package com.trading.approval.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GuardMode {
    NORMAL("normal"),
    DEGRADED("degraded"),
    STREAMS_PANIC("streams_panic"),
    HALT_ENTRY("halt_entry");

    private final String code;

    GuardMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static GuardMode fromCode(String code) {
        for (GuardMode mode : values()) {
            if (mode.code.equalsIgnoreCase(code) || mode.name().equalsIgnoreCase(code)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown guard mode: " + code);
    }
}
