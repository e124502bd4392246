package com.trading.approval.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RevocationReason {
    TTL_EXPIRED("TtlExpired"),
    MANUAL_REVOKE("ManualRevoke"),
    SUPERSEDED("Superseded");

    private final String code;

    RevocationReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static RevocationReason fromCode(String code) {
        for (RevocationReason reason : values()) {
            if (reason.code.equalsIgnoreCase(code) || reason.name().equalsIgnoreCase(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown revocation reason: " + code);
    }
}
