package com.trading.approval.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Approval withdrawn after the fact (topic approval.revoked)")
public record RevokedDecision(
        String approvalKey,
        RevocationReason reason,
        Rollback rollback,
        long timestamp) implements Decision {

    @Override
    public DecisionType type() {
        return DecisionType.REVOKED;
    }
}
