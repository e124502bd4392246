package com.trading.approval.service;

import com.trading.approval.config.MetricsConfig;
import com.trading.approval.model.AlertLevel;
import com.trading.approval.model.ApprovalAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raises {@code approval.alert} events and hands every alert to the pager, which applies its own threshold.
 */
@Service
public class ApprovalAlertService {

    public static final String TOPIC = "approval.alert";

    private static final Logger log = LoggerFactory.getLogger(ApprovalAlertService.class);

    private final DecisionEventPublisher publisher;
    private final TwilioNotificationService notificationService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ApprovalAlertService(DecisionEventPublisher publisher,
                                TwilioNotificationService notificationService,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.publisher = publisher;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public ApprovalAlert raise(AlertLevel level, String message, String approvalKey, String action) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("approvalKey", approvalKey);
        context.put("action", action);
        return raise(level, message, context);
    }

    public ApprovalAlert raise(AlertLevel level, String message, Map<String, Object> context) {
        ApprovalAlert alert = new ApprovalAlert(level, message, context, clock.millis());

        switch (level) {
            case INFO -> log.info("Approval alert: {} {}", message, context);
            case WARN -> log.warn("Approval alert: {} {}", message, context);
            case ERROR, CRITICAL -> log.error("Approval alert [{}]: {} {}", level.getCode(), message, context);
        }

        metricsConfig.recordAlert(level.getCode());
        publisher.publish(TOPIC, alert);
        notificationService.notifyAlert(alert);
        return alert;
    }
}
