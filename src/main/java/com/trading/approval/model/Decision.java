package com.trading.approval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Outcome of processing an approval key. The {@code event} property carries the
 * outbound topic so a serialized decision is self-describing.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ApprovedDecision.class, name = "action.approved"),
        @JsonSubTypes.Type(value = RejectedDecision.class, name = "action.rejected"),
        @JsonSubTypes.Type(value = PendingDecision.class, name = "approval.pending"),
        @JsonSubTypes.Type(value = RevokedDecision.class, name = "approval.revoked")
})
public interface Decision {

    String approvalKey();

    /** Emission time, epoch millis. */
    long timestamp();

    @JsonIgnore
    DecisionType type();
}
