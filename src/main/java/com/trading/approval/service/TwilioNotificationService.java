package com.trading.approval.service;

import com.trading.approval.config.MetricsConfig;
import com.trading.approval.config.TwilioNotificationConfig;
import com.trading.approval.model.ApprovalAlert;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.stream.Collectors;

@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}, minLevel: {}",
                    config.getChannel(), config.getMinLevel().getCode());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    /**
     * Page the on-call operator. Alerts below the configured minimum level are ignored.
     */
    @Async
    @Observed(name = "notification.send", contextualName = "send-alert-notification")
    public void notifyAlert(ApprovalAlert alert) {
        if (!config.pages(alert.level())) {
            return;
        }

        try {
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getOnCallNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    buildMessageBody(alert)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Approval alert notification sent: level={}, sid={}", alert.level(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send approval alert notification: {}", e.getMessage(), e);
        }
    }

    String buildMessageBody(ApprovalAlert alert) {
        String context = alert.context().entrySet().stream()
                .map(Map.Entry::toString)
                .collect(Collectors.joining("\n"));
        return String.format(
                "[APPROVAL %s] %s%n%s",
                alert.level().getCode().toUpperCase(),
                alert.message(),
                context);
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
