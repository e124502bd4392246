package com.trading.approval.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Approval chain still accumulating consent (topic approval.pending)")
public record PendingDecision(
        String approvalKey,
        String action,
        QuorumNeed needed,
        List<Approver> received,
        @Schema(description = "Chain deadline, epoch millis") long expiresAt,
        long timestamp) implements Decision {

    public PendingDecision {
        received = received == null ? List.of() : List.copyOf(received);
    }

    public static PendingDecision of(ApprovalChain chain, long now) {
        return new PendingDecision(chain.approvalKey(), chain.action(),
                QuorumNeed.of(chain.profile()), chain.approvers(), chain.expiresAt(), now);
    }

    @Override
    public DecisionType type() {
        return DecisionType.PENDING;
    }
}
