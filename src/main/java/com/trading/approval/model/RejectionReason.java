package com.trading.approval.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure taxonomy carried by {@link RejectedDecision}.
 */
public enum RejectionReason {
    SIGNATURE_INVALID("SignatureInvalid"),
    FORBIDDEN("Forbidden"),
    REASON_TOO_SHORT("ReasonTooShort"),
    BOUNDS_NOT_FRESH("BoundsNotFresh"),
    ALLOWLIST_VIOLATION("AllowlistViolation"),
    UNKNOWN_ACTION("UnknownAction"),
    INSUFFICIENT_QUORUM("InsufficientQuorum"),
    INTERNAL_ERROR("InternalError");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
