package com.trading.approval.engine;

import com.trading.approval.model.ApprovalChain;
import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.ApprovalRequest;
import com.trading.approval.model.Approver;
import com.trading.approval.model.ChainStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the lifetime of approval chains: opening, folding in distinct approvers, completion
 * and expiry. Every transition is a single atomic {@code compute} on the chain map, so the
 * duplicate-identity check and the append can never interleave with another submission.
 *
 * Completed and expired chains leave the map as part of the transition that terminates them.
 */
@Component
public class ApprovalChainBuilder {

    private static final Logger log = LoggerFactory.getLogger(ApprovalChainBuilder.class);

    private final ConcurrentHashMap<String, ApprovalChain> chains = new ConcurrentHashMap<>();

    /**
     * Outcome of folding one approver into a chain.
     *
     * @param chain     the chain after the fold (complete chains are already removed from the store)
     * @param appended  whether the approver was counted
     * @param outcome   what happened
     */
    public record FoldResult(ApprovalChain chain, boolean appended, Outcome outcome) {

        public enum Outcome { OPENED, APPENDED, DUPLICATE, OVERDUE, COMPLETED }

        public boolean completed() {
            return outcome == Outcome.COMPLETED;
        }
    }

    /**
     * Fold a gate-approved submission into the chain for its key, opening the chain if needed.
     *
     * @param profile profile to snapshot when the chain is opened; ignored for an existing chain
     */
    public FoldResult fold(ApprovalRequest request, ApprovalProfile profile, long now) {
        Approver approver = request.getRequester().toApprover(now);
        FoldResult[] result = new FoldResult[1];

        chains.compute(request.getApprovalKey(), (key, existing) -> {
            ApprovalChain chain = existing;
            FoldResult.Outcome outcome = FoldResult.Outcome.APPENDED;

            if (chain == null) {
                chain = ApprovalChain.open(request, profile, now);
                outcome = FoldResult.Outcome.OPENED;
            } else if (chain.isOverdue(now)) {
                // Frozen until the sweeper expires it.
                result[0] = new FoldResult(chain, false, FoldResult.Outcome.OVERDUE);
                return chain;
            } else if (chain.hasApprover(approver.identity())) {
                result[0] = new FoldResult(chain, false, FoldResult.Outcome.DUPLICATE);
                return chain;
            }

            ApprovalChain next = chain.withApprover(approver);
            if (next.isComplete()) {
                result[0] = new FoldResult(next, true, FoldResult.Outcome.COMPLETED);
                return null;
            }
            result[0] = new FoldResult(next, true, outcome);
            return next;
        });

        FoldResult folded = result[0];
        log.debug("Chain {} fold by {}: {} ({}/{})", request.getApprovalKey(), approver.identity(),
                folded.outcome(), folded.chain().approvers().size(), folded.chain().profile().requiredApprovals());
        return folded;
    }

    public Optional<ApprovalChain> find(String approvalKey) {
        return Optional.ofNullable(chains.get(approvalKey));
    }

    /** Accumulating chains whose deadline has passed, oldest deadline first. */
    public List<ApprovalChain> overdue(long now) {
        List<ApprovalChain> result = new ArrayList<>();
        for (ApprovalChain chain : chains.values()) {
            if (chain.isOverdue(now)) {
                result.add(chain);
            }
        }
        result.sort(Comparator.comparingLong(ApprovalChain::expiresAt));
        return result;
    }

    /**
     * Remove an overdue chain and return it marked expired. Empty when the chain is gone or
     * not yet overdue.
     */
    public Optional<ApprovalChain> expire(String approvalKey, long now) {
        ApprovalChain[] expired = new ApprovalChain[1];
        chains.computeIfPresent(approvalKey, (key, chain) -> {
            if (!chain.isOverdue(now)) {
                return chain;
            }
            expired[0] = chain.withStatus(ChainStatus.EXPIRED);
            return null;
        });
        return Optional.ofNullable(expired[0]);
    }

    public Optional<ApprovalChain> discard(String approvalKey) {
        return Optional.ofNullable(chains.remove(approvalKey));
    }

    public int activeCount() {
        return chains.size();
    }

    public List<ApprovalChain> activeChains() {
        List<ApprovalChain> result = new ArrayList<>(chains.values());
        result.sort(Comparator.comparingLong(ApprovalChain::createdAt));
        return result;
    }
}
