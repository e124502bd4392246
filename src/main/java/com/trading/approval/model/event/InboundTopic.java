package com.trading.approval.model.event;

public enum InboundTopic {
    OPERATOR_DECISION_FINAL("operator.decision.final"),
    MANUAL_APPROVAL_REQUEST("manual.approval.request"),
    POLICY_SNAPSHOT("policy.snapshot"),
    GUARD_DIRECTIVE("environment.guard.directive"),
    BOUNDS_CHECK_RESULT("bounds.check.result"),
    EMERGENCY_STOP("emergency.stop");

    private final String topic;

    InboundTopic(String topic) {
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
