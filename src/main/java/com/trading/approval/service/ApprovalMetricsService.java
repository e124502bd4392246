package com.trading.approval.service;

import com.trading.approval.config.MetricsConfig;
import com.trading.approval.engine.ApprovalChainBuilder;
import com.trading.approval.model.ApprovalMetricsSnapshot;
import com.trading.approval.model.ApprovedDecision;
import com.trading.approval.model.Decision;
import com.trading.approval.model.RejectedDecision;
import com.trading.approval.repository.ApprovalGrantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running decision tallies behind the periodic {@code approval.metrics} summary.
 */
@Service
public class ApprovalMetricsService {

    public static final String TOPIC = "approval.metrics";

    private static final Logger log = LoggerFactory.getLogger(ApprovalMetricsService.class);

    private final ApprovalChainBuilder chainBuilder;
    private final ApprovalGrantRegistry grantRegistry;
    private final DecisionEventPublisher publisher;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final AtomicLong approved = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong revoked = new AtomicLong();
    private final ConcurrentHashMap<String, LongAdder> byAction = new ConcurrentHashMap<>();

    // Lead time is summed in millis so the average stays exact.
    private final AtomicLong leadTimeTotalMillis = new AtomicLong();
    private final AtomicLong leadTimeSamples = new AtomicLong();

    public ApprovalMetricsService(ApprovalChainBuilder chainBuilder,
                                  ApprovalGrantRegistry grantRegistry,
                                  DecisionEventPublisher publisher,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.chainBuilder = chainBuilder;
        this.grantRegistry = grantRegistry;
        this.publisher = publisher;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public void recordDecision(Decision decision) {
        String action = null;
        switch (decision.type()) {
            case APPROVED -> {
                approved.incrementAndGet();
                action = ((ApprovedDecision) decision).action();
            }
            case REJECTED -> {
                rejected.incrementAndGet();
                action = ((RejectedDecision) decision).action();
            }
            case REVOKED -> revoked.incrementAndGet();
            case PENDING -> {
                // pending chains are counted live, not tallied
            }
        }
        if (action != null) {
            byAction.computeIfAbsent(action, a -> new LongAdder()).increment();
        }
        metricsConfig.recordDecision(decision.type().name().toLowerCase(), action);
    }

    public void recordLeadTime(long millis) {
        long clamped = Math.max(0, millis);
        leadTimeTotalMillis.addAndGet(clamped);
        leadTimeSamples.incrementAndGet();
        metricsConfig.recordLeadTime(clamped / 1000.0);
    }

    public ApprovalMetricsSnapshot snapshot() {
        Map<String, Long> actions = new TreeMap<>();
        byAction.forEach((action, count) -> actions.put(action, count.sum()));

        long samples = leadTimeSamples.get();
        double avgLeadTime = samples == 0 ? 0.0 : leadTimeTotalMillis.get() / 1000.0 / samples;

        return new ApprovalMetricsSnapshot(
                chainBuilder.activeCount(),
                approved.get(),
                rejected.get(),
                revoked.get(),
                actions,
                avgLeadTime,
                clock.millis());
    }

    @Scheduled(fixedRateString = "${approval.metrics-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${approval.metrics-interval-seconds:60}")
    public void publishSummary() {
        metricsConfig.updateActiveChainCount(chainBuilder.activeCount());
        metricsConfig.updateLiveGrantCount(grantRegistry.size());

        ApprovalMetricsSnapshot snapshot = snapshot();
        publisher.publish(TOPIC, snapshot);
        log.debug("Approval metrics: pending={}, approved={}, rejected={}, revoked={}, avgLeadTime={}s",
                snapshot.pending(), snapshot.approved(), snapshot.rejected(), snapshot.revoked(),
                String.format("%.1f", snapshot.avgLeadTimeSeconds()));
    }
}
