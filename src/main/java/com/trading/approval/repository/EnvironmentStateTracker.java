package com.trading.approval.repository;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.model.BoundsCheckResult;
import com.trading.approval.model.EmergencyStop;
import com.trading.approval.model.EnvironmentSnapshot;
import com.trading.approval.model.GuardMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Guard mode, emergency stop and recent bounds checks, published as one immutable
 * {@link EnvironmentSnapshot}. Every update builds a new snapshot and swaps it in.
 */
@Repository
public class EnvironmentStateTracker {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentStateTracker.class);

    private final ApprovalGatewayConfig config;
    private final AtomicReference<EnvironmentSnapshot> current = new AtomicReference<>(EnvironmentSnapshot.INITIAL);

    public EnvironmentStateTracker(ApprovalGatewayConfig config) {
        this.config = config;
    }

    public EnvironmentSnapshot current() {
        return current.get();
    }

    public void applyGuardDirective(GuardMode mode, long expiresAt) {
        current.updateAndGet(s -> s.withGuard(mode, expiresAt));
        log.info("Guard mode set to {} until {}", mode.getCode(), expiresAt);
    }

    public void applyEmergencyStop(boolean active, String reason, long now) {
        current.updateAndGet(s -> s.withEmergencyStop(new EmergencyStop(active, reason, now)));
        if (active) {
            log.warn("EMERGENCY STOP ACTIVE: {}", reason);
        } else {
            log.info("Emergency stop cleared: {}", reason);
        }
    }

    /**
     * Upserts a bounds-check result. Re-recording a checkId moves it to the newest position.
     */
    public void recordBoundsCheck(BoundsCheckResult result) {
        int retention = Math.max(1, config.getBoundsCheckRetention());
        current.updateAndGet(s -> {
            Map<String, BoundsCheckResult> checks = new LinkedHashMap<>(s.boundsChecks());
            checks.remove(result.checkId());
            checks.put(result.checkId(), result);
            Iterator<String> oldest = checks.keySet().iterator();
            while (checks.size() > retention && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
            }
            return s.withBoundsChecks(checks);
        });
        log.info("Bounds check recorded: {} ok={}", result.checkId(), result.ok());
    }

    /**
     * Drops bounds checks that can no longer satisfy the freshness gate.
     *
     * @return number of results removed
     */
    public int evictStaleBoundsChecks(long now) {
        long windowMillis = config.getBoundsFreshnessSeconds() * 1000L;
        int[] removed = new int[1];
        current.updateAndGet(s -> {
            Map<String, BoundsCheckResult> checks = new LinkedHashMap<>(s.boundsChecks());
            int before = checks.size();
            checks.values().removeIf(r -> !r.isFreshAt(now, windowMillis));
            removed[0] = before - checks.size();
            return removed[0] == 0 ? s : s.withBoundsChecks(checks);
        });
        return removed[0];
    }
}
