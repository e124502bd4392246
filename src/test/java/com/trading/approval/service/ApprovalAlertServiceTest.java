package com.trading.approval.service;

import com.trading.approval.config.MetricsConfig;
import com.trading.approval.model.AlertLevel;
import com.trading.approval.model.ApprovalAlert;
import com.trading.approval.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static com.trading.approval.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ApprovalAlertServiceTest {

    @Mock private DecisionEventPublisher publisher;
    @Mock private TwilioNotificationService notifications;
    @Mock private MetricsConfig metricsConfig;

    private ApprovalAlertService alertService;

    @BeforeEach
    void setUp() {
        alertService = new ApprovalAlertService(publisher, notifications, metricsConfig,
                new MutableClock(Instant.ofEpochMilli(NOW)));
    }

    @Test
    void raise_publishesCountsAndHandsToPager() {
        ApprovalAlert alert = alertService.raise(AlertLevel.WARN, "Emergency bypass used", "halt-1", "halt_entry");

        assertThat(alert.timestamp()).isEqualTo(NOW);
        assertThat(alert.context()).containsEntry("approvalKey", "halt-1").containsEntry("action", "halt_entry");
        verify(publisher).publish(ApprovalAlertService.TOPIC, alert);
        verify(metricsConfig).recordAlert("warn");
        verify(notifications).notifyAlert(alert);
    }

    @Test
    void raise_error_countedUnderItsLevel() {
        ApprovalAlert alert = alertService.raise(AlertLevel.ERROR, "Target not allowlisted", "fo-1", "failover");

        assertThat(alert.level()).isEqualTo(AlertLevel.ERROR);
        verify(metricsConfig).recordAlert("error");
        verify(notifications).notifyAlert(alert);
        verifyNoMoreInteractions(notifications);
    }
}
