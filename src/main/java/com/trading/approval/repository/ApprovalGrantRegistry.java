package com.trading.approval.repository;

import com.trading.approval.model.ApprovalGrant;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Approvals whose action TTL is still running, awaiting revocation by the sweeper.
 */
@Repository
public class ApprovalGrantRegistry {

    private final ConcurrentHashMap<String, ApprovalGrant> grants = new ConcurrentHashMap<>();

    public void register(ApprovalGrant grant) {
        grants.put(grant.approvalKey(), grant);
    }

    public Optional<ApprovalGrant> find(String approvalKey) {
        return Optional.ofNullable(grants.get(approvalKey));
    }

    public Optional<ApprovalGrant> remove(String approvalKey) {
        return Optional.ofNullable(grants.remove(approvalKey));
    }

    public List<ApprovalGrant> findDue(long now) {
        return grants.values().stream()
                .filter(g -> g.isDue(now))
                .toList();
    }

    public int size() {
        return grants.size();
    }
}
