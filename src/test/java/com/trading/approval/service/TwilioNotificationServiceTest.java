package com.trading.approval.service;

import com.trading.approval.config.MetricsConfig;
import com.trading.approval.config.TwilioNotificationConfig;
import com.trading.approval.model.AlertLevel;
import com.trading.approval.model.ApprovalAlert;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TwilioNotificationServiceTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final TwilioNotificationService service =
            new TwilioNotificationService(new TwilioNotificationConfig(), new MetricsConfig(meterRegistry));

    @Test
    void buildMessageBody_includesLevelMessageAndContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("approvalKey", "fo-1");
        context.put("action", "failover");

        String body = service.buildMessageBody(new ApprovalAlert(AlertLevel.ERROR, "Target not allowlisted", context, 0L));

        assertThat(body).startsWith("[APPROVAL ERROR] Target not allowlisted");
        assertThat(body).contains("approvalKey=fo-1").contains("action=failover");
    }

    @Test
    void notifyAlert_disabled_sendsNothing() {
        service.notifyAlert(new ApprovalAlert(AlertLevel.CRITICAL, "Decision log unavailable", Map.of(), 0L));

        assertThat(meterRegistry.find("notification.sent.count").counters()).isEmpty();
    }

    @Test
    void pages_defaultThresholdIsError() {
        TwilioNotificationConfig config = new TwilioNotificationConfig();
        config.setEnabled(true);

        assertThat(config.pages(AlertLevel.WARN)).isFalse();
        assertThat(config.pages(AlertLevel.ERROR)).isTrue();
        assertThat(config.pages(AlertLevel.CRITICAL)).isTrue();
    }

    @Test
    void pages_thresholdLoweredToWarn() {
        TwilioNotificationConfig config = new TwilioNotificationConfig();
        config.setEnabled(true);
        config.setMinLevel(AlertLevel.WARN);

        assertThat(config.pages(AlertLevel.INFO)).isFalse();
        assertThat(config.pages(AlertLevel.WARN)).isTrue();
    }

    @Test
    void pages_disabledNeverPages() {
        TwilioNotificationConfig config = new TwilioNotificationConfig();
        config.setMinLevel(AlertLevel.INFO);

        assertThat(config.pages(AlertLevel.CRITICAL)).isFalse();
    }

    @Test
    void notifyAlert_belowThreshold_sendsNothing() {
        TwilioNotificationConfig config = new TwilioNotificationConfig();
        config.setEnabled(true);
        TwilioNotificationService enabled = new TwilioNotificationService(config, new MetricsConfig(meterRegistry));

        enabled.notifyAlert(new ApprovalAlert(AlertLevel.WARN, "Emergency bypass used", Map.of(), 0L));

        assertThat(meterRegistry.find("notification.sent.count").counters()).isEmpty();
    }
}
