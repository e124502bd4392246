package com.trading.approval.service;

import com.trading.approval.model.Decision;

/**
 * Outbound side of the gateway. Every decision, alert and metrics summary leaves through
 * this interface, keyed by its topic.
 *
 * <p>Implementations must not block the caller for long and must not throw; a failed
 * publication never changes a decision that has already been made.
 */
public interface DecisionEventPublisher {

    /**
     * Publish a payload on an outbound topic.
     *
     * @param topic   outbound topic, e.g. {@code action.approved} or {@code approval.alert}
     * @param payload the event body
     */
    void publish(String topic, Object payload);

    default void publish(Decision decision) {
        publish(decision.type().getTopic(), decision);
    }
}
