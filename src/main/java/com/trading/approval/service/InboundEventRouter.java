package com.trading.approval.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.approval.config.MetricsConfig;
import com.trading.approval.model.Decision;
import com.trading.approval.model.event.BoundsCheckResultEvent;
import com.trading.approval.model.event.EmergencyStopEvent;
import com.trading.approval.model.event.GuardDirectiveEvent;
import com.trading.approval.model.event.InboundEvent;
import com.trading.approval.model.event.ManualApprovalRequestEvent;
import com.trading.approval.model.event.OperatorDecisionFinalEvent;
import com.trading.approval.model.event.PolicySnapshotEvent;
import com.trading.approval.repository.EnvironmentStateTracker;
import com.trading.approval.repository.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Parses, validates and dispatches inbound events, one handler per topic. Events that fail
 * to parse or validate are dropped without touching any state.
 */
@Service
public class InboundEventRouter {

    private static final Logger log = LoggerFactory.getLogger(InboundEventRouter.class);

    private final ObjectMapper objectMapper;
    private final ApprovalGatewayService gatewayService;
    private final PolicyStore policyStore;
    private final EnvironmentStateTracker environmentTracker;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public InboundEventRouter(ObjectMapper objectMapper,
                              ApprovalGatewayService gatewayService,
                              PolicyStore policyStore,
                              EnvironmentStateTracker environmentTracker,
                              MetricsConfig metricsConfig,
                              Clock clock) {
        this.objectMapper = objectMapper;
        this.gatewayService = gatewayService;
        this.policyStore = policyStore;
        this.environmentTracker = environmentTracker;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public IngestionResult route(String json) {
        InboundEvent event;
        try {
            event = objectMapper.readValue(json, InboundEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable inbound event: {}", e.getOriginalMessage());
            metricsConfig.recordDroppedEvent("unparseable");
            return IngestionResult.dropped(null, List.of(e.getOriginalMessage()));
        }
        if (event == null) {
            metricsConfig.recordDroppedEvent("unparseable");
            return IngestionResult.dropped(null, List.of("empty event"));
        }
        return route(event);
    }

    public IngestionResult route(InboundEvent event) {
        List<String> problems = event.validate();
        if (!problems.isEmpty()) {
            log.warn("Dropping invalid {} event: {}", event.topic().getTopic(), problems);
            metricsConfig.recordDroppedEvent(event.topic().getTopic());
            return IngestionResult.dropped(event.topic(), problems);
        }

        long now = clock.millis();
        switch (event.topic()) {
            case OPERATOR_DECISION_FINAL -> {
                OperatorDecisionFinalEvent decision = (OperatorDecisionFinalEvent) event;
                if (!decision.getAccepted()) {
                    log.debug("Operator decision {} not accepted, ignoring", decision.getDecisionId());
                    return IngestionResult.ignored(event.topic());
                }
                Decision result = gatewayService.submit(decision.toApprovalRequest());
                return IngestionResult.decided(event.topic(), result);
            }
            case MANUAL_APPROVAL_REQUEST -> {
                Decision result = gatewayService.submit(((ManualApprovalRequestEvent) event).toApprovalRequest());
                return IngestionResult.decided(event.topic(), result);
            }
            case POLICY_SNAPSHOT -> policyStore.replace(((PolicySnapshotEvent) event).toSnapshot(now));
            case GUARD_DIRECTIVE -> {
                GuardDirectiveEvent directive = (GuardDirectiveEvent) event;
                environmentTracker.applyGuardDirective(directive.getMode(), directive.getExpiresAt().toEpochMilli());
            }
            case BOUNDS_CHECK_RESULT -> environmentTracker.recordBoundsCheck(((BoundsCheckResultEvent) event).toResult(now));
            case EMERGENCY_STOP -> {
                EmergencyStopEvent stop = (EmergencyStopEvent) event;
                environmentTracker.applyEmergencyStop(stop.getActive(), stop.getReason(), now);
            }
        }
        return IngestionResult.applied(event.topic());
    }
}
