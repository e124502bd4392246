package com.trading.approval.config;

import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.ProfileKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "approval")
public class ApprovalGatewayConfig {

    // How long an Approved/Rejected decision is replayed for its approval key.
    private long idempotencyTtlSeconds = 600;

    // Expiry sweep cadence. Chains are never timed individually.
    private int sweepIntervalSeconds = 60;

    private int metricsIntervalSeconds = 60;

    // Emit approval.revoked{TtlExpired} once an approved action's ttlSeconds has elapsed.
    private boolean revokeOnTtlExpire = true;

    // Bounds-check results older than this do not satisfy the freshness gate.
    private long boundsFreshnessSeconds = 300;

    // Upper bound on retained bounds-check results (oldest evicted first).
    private int boundsCheckRetention = 256;

    // Outbound events kept in memory for the recent-events endpoint.
    private int eventJournalSize = 200;

    // Action -> compensating event name attached to TTL revocations.
    private Map<String, String> rollbackEvents = new LinkedHashMap<>(Map.of("halt_entry", "resume_entry"));

    private Security security = new Security();

    private Defaults defaults = new Defaults();

    private Rules rules = new Rules();

    @Data
    public static class Security {
        private boolean verifySignature = true;
        // Upper bound on a single signature verification; slower verifiers fail closed.
        private long verifyTimeoutMs = 500;
        private int verifierThreads = 4;
        private int verifierQueueCapacity = 32;
    }

    @Data
    public static class Defaults {
        // Built-in profiles used when the policy snapshot has none for an action.
        private Map<String, ProfileDefinition> profiles = defaultProfiles();

        // Action -> built-in profile name.
        private Map<String, String> actionCategories = new LinkedHashMap<>(Map.of(
                "halt_entry", "dual",
                "failover", "dual",
                "aggressive_overrides", "single",
                "risk_limit_change", "quorum"));

        // Fallback allowlists by action, applied when the profile carries none.
        private Map<String, List<String>> allowlists = new LinkedHashMap<>(Map.of("failover", List.of()));

        private static Map<String, ProfileDefinition> defaultProfiles() {
            Map<String, ProfileDefinition> profiles = new LinkedHashMap<>();
            profiles.put("dual", new ProfileDefinition(ProfileKind.DUAL, 2, 2, 300, 0));
            profiles.put("single", new ProfileDefinition(ProfileKind.SINGLE, 1, 1, 600, 20));
            profiles.put("quorum", new ProfileDefinition(ProfileKind.QUORUM, 2, 3, 600, 0));
            return profiles;
        }
    }

    @Data
    public static class ProfileDefinition {
        private ProfileKind kind = ProfileKind.SINGLE;
        private int quorumCount = 1;
        private int ofCount = 1;
        private long ttlSeconds = 300;
        private int minReasonChars = 0;
        private List<String> allowlist = new ArrayList<>();

        public ProfileDefinition() {
        }

        public ProfileDefinition(ProfileKind kind, int quorumCount, int ofCount, long ttlSeconds, int minReasonChars) {
            this.kind = kind;
            this.quorumCount = quorumCount;
            this.ofCount = ofCount;
            this.ttlSeconds = ttlSeconds;
            this.minReasonChars = minReasonChars;
        }

        public ApprovalProfile toProfile() {
            return new ApprovalProfile(kind, quorumCount, ofCount, ttlSeconds, minReasonChars, allowlist).normalized();
        }
    }

    @Data
    public static class Rules {
        // Actions that need a fresh passing bounds check.
        private List<String> requireFreshBounds = new ArrayList<>(List.of("aggressive_overrides"));

        // Global-protective actions eligible for single-party approval during an emergency stop.
        private List<String> emergencyBypassActions = new ArrayList<>(List.of("halt_entry"));

        // Payload entry that marks a protective action as global.
        private String emergencyScopeKey = "scope";
        private String emergencyScopeValue = "global";

        // Payload entries naming the action's target, checked against the allowlist in order.
        private List<String> targetParameterKeys = new ArrayList<>(List.of("to", "target"));

        // Payload entry naming a specific bounds check the action relies on.
        private String boundsCheckIdKey = "boundsCheckId";
    }
}
