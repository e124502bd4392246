package com.trading.approval.service;

import com.trading.approval.model.GatewayEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Publishes outbound events as Spring application events wrapped in a {@link GatewayEvent}.
 * In-process listeners (the outbound journal among them) receive them synchronously.
 */
@Component
public class ApplicationDecisionEventPublisher implements DecisionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(ApplicationDecisionEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public ApplicationDecisionEventPublisher(ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    @Override
    public void publish(String topic, Object payload) {
        try {
            applicationEventPublisher.publishEvent(new GatewayEvent(topic, payload, clock.millis()));
            log.debug("Published {}", topic);
        } catch (RuntimeException e) {
            log.warn("Publishing {} failed (non-critical): {}", topic, e.getMessage(), e);
        }
    }
}
