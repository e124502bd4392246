package com.trading.approval.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeChainCount;
    private final AtomicInteger liveGrantCount;
    private final AtomicInteger lockedKeyCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeChainCount = registry.gauge("approval.chains.active", new AtomicInteger(0));
        this.liveGrantCount = registry.gauge("approval.grants.live", new AtomicInteger(0));
        this.lockedKeyCount = registry.gauge("approval.locks.active", new AtomicInteger(0));
    }

    public void recordDecision(String type, String action) {
        Counter.builder("approval.decisions")
                .tag("type", type)
                .tag("action", action != null ? action : "unknown")
                .register(registry)
                .increment();
    }

    public void recordGateFailure(String reason) {
        Counter.builder("approval.gate.failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordReplay() {
        Counter.builder("approval.idempotent.replays")
                .register(registry)
                .increment();
    }

    public void recordLeadTime(double seconds) {
        DistributionSummary.builder("approval.lead_time_seconds")
                .baseUnit("seconds")
                .register(registry)
                .record(seconds);
    }

    public void recordAlert(String level) {
        Counter.builder("approval.alerts")
                .tag("level", level)
                .register(registry)
                .increment();
    }

    public void recordDroppedEvent(String topic) {
        Counter.builder("approval.inbound.dropped")
                .tag("topic", topic)
                .register(registry)
                .increment();
    }

    public void recordDecisionLogWrite(String status) {
        Counter.builder("approval.decision_log.writes")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateActiveChainCount(int count) {
        activeChainCount.set(count);
    }

    public void updateLiveGrantCount(int count) {
        liveGrantCount.set(count);
    }

    public void updateLockedKeyCount(int count) {
        lockedKeyCount.set(count);
    }
}
