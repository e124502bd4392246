package com.trading.approval.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable role and profile policy. Replaced wholesale on every policy.snapshot, never merged.
 */
@Schema(description = "Current role-to-action map and named approval profiles")
public record PolicySnapshot(
        @Schema(description = "Role name to the actions it may request or approve") Map<String, List<String>> roles,
        @Schema(description = "Approval profiles keyed by action") Map<String, ApprovalProfile> approvalProfiles,
        @Schema(description = "Time the snapshot was installed, epoch millis") long installedAt) {

    public static final PolicySnapshot EMPTY = new PolicySnapshot(Map.of(), Map.of(), 0L);

    public PolicySnapshot {
        roles = roles == null ? Map.of() : Map.copyOf(roles);
        approvalProfiles = approvalProfiles == null ? Map.of() : Map.copyOf(approvalProfiles);
    }

    public boolean permits(Collection<String> requesterRoles, String action) {
        if (requesterRoles == null || action == null) {
            return false;
        }
        for (String role : requesterRoles) {
            List<String> allowed = roles.get(role);
            if (allowed != null && allowed.contains(action)) {
                return true;
            }
        }
        return false;
    }

    public Optional<ApprovalProfile> profileFor(String action) {
        return Optional.ofNullable(approvalProfiles.get(action));
    }

    public boolean isLoaded() {
        return installedAt > 0;
    }
}
