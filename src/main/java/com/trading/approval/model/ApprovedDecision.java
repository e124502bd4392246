package com.trading.approval.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Schema(description = "Action authorized for execution (topic action.approved)")
public record ApprovedDecision(
        String approvalKey,
        String action,
        Map<String, Object> payload,
        long ttlSeconds,
        List<Approver> approvers,
        ChainRequirement chain,
        @Schema(description = "Initiator rationale, or the system reason for an emergency bypass") String reason,
        boolean emergencyBypass,
        AuditInfo audit,
        long timestamp) implements Decision {

    public ApprovedDecision {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        approvers = approvers == null ? List.of() : List.copyOf(approvers);
    }

    @Override
    public DecisionType type() {
        return DecisionType.APPROVED;
    }
}
