package com.trading.approval.model;

public record QuorumNeed(int quorum, int of) {

    public static QuorumNeed of(ApprovalProfile profile) {
        return new QuorumNeed(profile.requiredApprovals(), profile.poolSize());
    }
}
