package com.trading.approval.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Approval refused (topic action.rejected)")
public record RejectedDecision(
        String approvalKey,
        String action,
        List<RejectionReason> reasons,
        List<Approver> approvers,
        AuditInfo audit,
        long timestamp) implements Decision {

    public RejectedDecision {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        approvers = approvers == null ? List.of() : List.copyOf(approvers);
    }

    @Override
    public DecisionType type() {
        return DecisionType.REJECTED;
    }
}
