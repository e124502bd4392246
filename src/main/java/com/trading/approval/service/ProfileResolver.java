package com.trading.approval.service;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.PolicySnapshot;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Effective approval profile for an action: the policy's named profile, else the built-in
 * profile of the action's category. A caller TTL override replaces only the TTL.
 */
@Service
public class ProfileResolver {

    private final ApprovalGatewayConfig config;

    public ProfileResolver(ApprovalGatewayConfig config) {
        this.config = config;
    }

    public Optional<ApprovalProfile> resolve(String action, Long ttlOverrideSeconds, PolicySnapshot policy) {
        if (action == null) {
            return Optional.empty();
        }

        Optional<ApprovalProfile> profile = policy != null ? policy.profileFor(action) : Optional.empty();
        if (profile.isEmpty()) {
            profile = builtIn(action);
        }

        if (ttlOverrideSeconds != null && ttlOverrideSeconds >= 0) {
            return profile.map(p -> p.withTtlSeconds(ttlOverrideSeconds));
        }
        return profile;
    }

    private Optional<ApprovalProfile> builtIn(String action) {
        ApprovalGatewayConfig.Defaults defaults = config.getDefaults();
        String category = defaults.getActionCategories().get(action);
        if (category == null) {
            return Optional.empty();
        }
        ApprovalGatewayConfig.ProfileDefinition definition = defaults.getProfiles().get(category);
        return definition == null ? Optional.empty() : Optional.of(definition.toProfile());
    }
}
