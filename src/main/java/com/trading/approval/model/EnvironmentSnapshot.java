package com.trading.approval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the operating environment. Bounds checks keep insertion order so the
 * oldest entry is evicted first once the retention cap is reached.
 */
@Schema(description = "Guard mode, emergency stop and recent bounds-check results")
public record EnvironmentSnapshot(
        GuardMode guardMode,
        @Schema(description = "Guard directive expiry, epoch millis; 0 means no expiry") long guardExpiresAt,
        EmergencyStop emergencyStop,
        Map<String, BoundsCheckResult> boundsChecks) {

    public static final EnvironmentSnapshot INITIAL =
            new EnvironmentSnapshot(GuardMode.NORMAL, 0L, EmergencyStop.INACTIVE, Map.of());

    public EnvironmentSnapshot {
        boundsChecks = boundsChecks == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(boundsChecks));
    }

    /**
     * Guard mode in force at {@code now}; an expired directive falls back to normal.
     */
    public GuardMode effectiveGuardMode(long now) {
        if (guardExpiresAt > 0 && now >= guardExpiresAt) {
            return GuardMode.NORMAL;
        }
        return guardMode;
    }

    @JsonIgnore
    public boolean isEmergencyStopActive() {
        return emergencyStop != null && emergencyStop.active();
    }

    /**
     * A fresh, passing bounds check. With a {@code checkId} only that result qualifies,
     * otherwise any fresh passing result does.
     */
    public Optional<BoundsCheckResult> freshPassingCheck(String checkId, long now, long windowMillis) {
        if (checkId != null) {
            return Optional.ofNullable(boundsChecks.get(checkId))
                    .filter(BoundsCheckResult::ok)
                    .filter(r -> r.isFreshAt(now, windowMillis));
        }
        return boundsChecks.values().stream()
                .filter(BoundsCheckResult::ok)
                .filter(r -> r.isFreshAt(now, windowMillis))
                .findFirst();
    }

    public EnvironmentSnapshot withGuard(GuardMode mode, long expiresAt) {
        return new EnvironmentSnapshot(mode, expiresAt, emergencyStop, boundsChecks);
    }

    public EnvironmentSnapshot withEmergencyStop(EmergencyStop stop) {
        return new EnvironmentSnapshot(guardMode, guardExpiresAt, stop, boundsChecks);
    }

    public EnvironmentSnapshot withBoundsChecks(Map<String, BoundsCheckResult> checks) {
        return new EnvironmentSnapshot(guardMode, guardExpiresAt, emergencyStop, checks);
    }
}
