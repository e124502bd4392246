package com.trading.approval.service;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.config.MetricsConfig;
import com.trading.approval.engine.ApprovalChainBuilder;
import com.trading.approval.engine.KeyedLocks;
import com.trading.approval.model.ApprovalChain;
import com.trading.approval.model.ApprovalGrant;
import com.trading.approval.model.RejectionReason;
import com.trading.approval.model.RevocationReason;
import com.trading.approval.model.Rollback;
import com.trading.approval.repository.ApprovalGrantRegistry;
import com.trading.approval.repository.EnvironmentStateTracker;
import com.trading.approval.repository.IdempotencyCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Central timer for everything that expires: overdue chains, idempotency entries, stale
 * bounds checks and approvals whose TTL has run out. Chains are never timed individually.
 */
@Service
public class ExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final ApprovalChainBuilder chainBuilder;
    private final IdempotencyCache idempotencyCache;
    private final ApprovalGrantRegistry grantRegistry;
    private final EnvironmentStateTracker environmentTracker;
    private final DecisionEmitter emitter;
    private final KeyedLocks keyedLocks;
    private final ApprovalGatewayConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public record SweepReport(int expiredChains, int evictedDecisions, int revokedGrants, int staleBoundsChecks) {

        public boolean isEmpty() {
            return expiredChains == 0 && evictedDecisions == 0 && revokedGrants == 0 && staleBoundsChecks == 0;
        }
    }

    public ExpirySweeper(ApprovalChainBuilder chainBuilder,
                         IdempotencyCache idempotencyCache,
                         ApprovalGrantRegistry grantRegistry,
                         EnvironmentStateTracker environmentTracker,
                         DecisionEmitter emitter,
                         KeyedLocks keyedLocks,
                         ApprovalGatewayConfig config,
                         MetricsConfig metricsConfig,
                         Clock clock) {
        this.chainBuilder = chainBuilder;
        this.idempotencyCache = idempotencyCache;
        this.grantRegistry = grantRegistry;
        this.environmentTracker = environmentTracker;
        this.emitter = emitter;
        this.keyedLocks = keyedLocks;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${approval.sweep-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${approval.sweep-interval-seconds:60}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Expiry sweep failed: {}", e.getMessage(), e);
        }
    }

    public SweepReport sweep() {
        long now = clock.millis();

        int expired = 0;
        for (ApprovalChain overdue : chainBuilder.overdue(now)) {
            if (expireChain(overdue.approvalKey(), now)) {
                expired++;
            }
        }

        int evicted = idempotencyCache.evictExpired(now);
        int staleBounds = environmentTracker.evictStaleBoundsChecks(now);

        int revoked = 0;
        if (config.isRevokeOnTtlExpire()) {
            for (ApprovalGrant grant : grantRegistry.findDue(now)) {
                if (revokeGrant(grant.approvalKey(), now)) {
                    revoked++;
                }
            }
        }

        metricsConfig.updateActiveChainCount(chainBuilder.activeCount());
        metricsConfig.updateLiveGrantCount(grantRegistry.size());
        metricsConfig.updateLockedKeyCount(keyedLocks.activeKeys());

        SweepReport report = new SweepReport(expired, evicted, revoked, staleBounds);
        if (!report.isEmpty()) {
            log.info("Expiry sweep: expiredChains={}, evictedDecisions={}, revokedGrants={}, staleBoundsChecks={}",
                    expired, evicted, revoked, staleBounds);
        }
        return report;
    }

    private boolean expireChain(String approvalKey, long now) {
        return keyedLocks.withLock(approvalKey, () -> {
            Optional<ApprovalChain> expired = chainBuilder.expire(approvalKey, now);
            expired.ifPresent(chain -> emitter.reject(approvalKey, chain.action(),
                    List.of(RejectionReason.INSUFFICIENT_QUORUM), chain.approvers(), now));
            return expired.isPresent();
        });
    }

    private boolean revokeGrant(String approvalKey, long now) {
        return keyedLocks.withLock(approvalKey, () -> {
            // Re-read under the lock: a manual revoke may have removed it meanwhile.
            Optional<ApprovalGrant> grant = grantRegistry.find(approvalKey).filter(g -> g.isDue(now));
            grant.ifPresent(g -> emitter.revoke(approvalKey, RevocationReason.TTL_EXPIRED, rollbackFor(g), now));
            return grant.isPresent();
        });
    }

    private Rollback rollbackFor(ApprovalGrant grant) {
        String event = config.getRollbackEvents().get(grant.action());
        return event == null ? null : new Rollback(event, grant.payload());
    }
}
