package com.trading.approval.model.event;

import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.PolicySnapshot;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Full replacement of the role map and approval profiles (topic policy.snapshot)")
public class PolicySnapshotEvent implements InboundEvent {

    @Schema(description = "Role name to permitted actions",
            example = "{\"risk_officer\": [\"halt_entry\", \"risk_limit_change\"]}")
    private Map<String, List<String>> roles;

    @Schema(description = "Approval profiles keyed by action")
    private Map<String, ApprovalProfile> approvalProfiles;

    @Override
    public InboundTopic topic() {
        return InboundTopic.POLICY_SNAPSHOT;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (roles == null) {
            problems.add("roles is required");
        } else {
            roles.forEach((role, actions) -> {
                if (InboundEvent.isBlank(role)) problems.add("role names must not be blank");
                if (actions == null || actions.stream().anyMatch(InboundEvent::isBlank)) {
                    problems.add("roles." + role + " must be a list of action names");
                }
            });
        }
        if (approvalProfiles == null) {
            problems.add("approvalProfiles is required");
        } else {
            approvalProfiles.forEach((action, profile) -> {
                if (profile == null) {
                    problems.add("approvalProfiles." + action + " is null");
                } else {
                    profile.violations().forEach(v -> problems.add("approvalProfiles." + action + ": " + v));
                }
            });
        }
        return problems;
    }

    public PolicySnapshot toSnapshot(long installedAt) {
        Map<String, ApprovalProfile> profiles = new LinkedHashMap<>();
        approvalProfiles.forEach((action, profile) -> profiles.put(action, profile.normalized()));
        Map<String, List<String>> roleMap = new LinkedHashMap<>();
        roles.forEach((role, actions) -> roleMap.put(role, List.copyOf(actions)));
        return new PolicySnapshot(roleMap, profiles, installedAt);
    }
}
