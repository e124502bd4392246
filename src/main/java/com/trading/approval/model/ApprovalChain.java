package com.trading.approval.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulation state for one approval key. Instances are immutable; every change
 * produces a new chain that replaces the old one in the chain store.
 */
public record ApprovalChain(
        String approvalKey,
        String action,
        Map<String, Object> payload,
        String reason,
        ApprovalProfile profile,
        List<Approver> approvers,
        long createdAt,
        long expiresAt,
        ChainStatus status) {

    public ApprovalChain {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        approvers = approvers == null ? List.of() : List.copyOf(approvers);
    }

    public static ApprovalChain open(ApprovalRequest request, ApprovalProfile profile, long now) {
        return new ApprovalChain(
                request.getApprovalKey(),
                request.getAction(),
                request.getPayload(),
                request.getReason(),
                profile,
                List.of(),
                now,
                now + profile.ttlSeconds() * 1000L,
                ChainStatus.ACCUMULATING);
    }

    public boolean hasApprover(String identity) {
        return approvers.stream().anyMatch(a -> a.identity().equals(identity));
    }

    public ApprovalChain withApprover(Approver approver) {
        List<Approver> next = new ArrayList<>(approvers);
        next.add(approver);
        ChainStatus nextStatus = next.size() >= profile.requiredApprovals()
                ? ChainStatus.COMPLETE
                : ChainStatus.ACCUMULATING;
        return new ApprovalChain(approvalKey, action, payload, reason, profile, next,
                createdAt, expiresAt, nextStatus);
    }

    public ApprovalChain withStatus(ChainStatus next) {
        return new ApprovalChain(approvalKey, action, payload, reason, profile, approvers,
                createdAt, expiresAt, next);
    }

    public boolean isComplete() {
        return status == ChainStatus.COMPLETE;
    }

    public boolean isOverdue(long now) {
        return status == ChainStatus.ACCUMULATING && now >= expiresAt;
    }
}
