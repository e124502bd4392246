package com.trading.approval.model.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * An inbound message. The {@code event} property selects the schema; anything that does not
 * parse into one of the subtypes, or fails {@link #validate()}, is dropped.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event")
@JsonSubTypes({
        @JsonSubTypes.Type(value = OperatorDecisionFinalEvent.class, name = "operator.decision.final"),
        @JsonSubTypes.Type(value = ManualApprovalRequestEvent.class, name = "manual.approval.request"),
        @JsonSubTypes.Type(value = PolicySnapshotEvent.class, name = "policy.snapshot"),
        @JsonSubTypes.Type(value = GuardDirectiveEvent.class, name = "environment.guard.directive"),
        @JsonSubTypes.Type(value = BoundsCheckResultEvent.class, name = "bounds.check.result"),
        @JsonSubTypes.Type(value = EmergencyStopEvent.class, name = "emergency.stop")
})
public interface InboundEvent {

    @JsonIgnore
    InboundTopic topic();

    /**
     * Schema violations, empty when the event is well-formed.
     */
    List<String> validate();

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
