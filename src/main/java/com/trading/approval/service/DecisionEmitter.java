package com.trading.approval.service;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.config.MetricsConfig;
import com.trading.approval.model.ApprovalChain;
import com.trading.approval.model.ApprovalGrant;
import com.trading.approval.model.ApprovedDecision;
import com.trading.approval.model.Approver;
import com.trading.approval.model.AuditInfo;
import com.trading.approval.model.ChainRequirement;
import com.trading.approval.model.Decision;
import com.trading.approval.model.PendingDecision;
import com.trading.approval.model.RejectedDecision;
import com.trading.approval.model.RejectionReason;
import com.trading.approval.model.RevocationReason;
import com.trading.approval.model.RevokedDecision;
import com.trading.approval.model.Rollback;
import com.trading.approval.repository.ApprovalGrantRegistry;
import com.trading.approval.repository.DecisionRepository;
import com.trading.approval.repository.IdempotencyCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns terminal transitions into immutable decisions and fans them out: idempotency cache,
 * grant registry, publisher, metrics and the decision log.
 *
 * Callers hold the approval key's lock.
 */
@Service
public class DecisionEmitter {

    private static final Logger log = LoggerFactory.getLogger(DecisionEmitter.class);

    private final IdempotencyCache idempotencyCache;
    private final ApprovalGrantRegistry grantRegistry;
    private final DecisionRepository decisionRepository;
    private final DecisionEventPublisher publisher;
    private final ApprovalMetricsService approvalMetrics;
    private final MetricsConfig metricsConfig;
    private final ApprovalGatewayConfig config;

    public DecisionEmitter(IdempotencyCache idempotencyCache,
                           ApprovalGrantRegistry grantRegistry,
                           DecisionRepository decisionRepository,
                           DecisionEventPublisher publisher,
                           ApprovalMetricsService approvalMetrics,
                           MetricsConfig metricsConfig,
                           ApprovalGatewayConfig config) {
        this.idempotencyCache = idempotencyCache;
        this.grantRegistry = grantRegistry;
        this.decisionRepository = decisionRepository;
        this.publisher = publisher;
        this.approvalMetrics = approvalMetrics;
        this.metricsConfig = metricsConfig;
        this.config = config;
    }

    /**
     * Emit {@code action.approved} for a chain that reached its requirement, or for an
     * emergency bypass.
     *
     * @param reason initiator rationale, or the system reason of a bypass
     */
    public ApprovedDecision approve(ApprovalChain chain, String reason, boolean emergencyBypass, long now) {
        ApprovedDecision decision = new ApprovedDecision(
                chain.approvalKey(),
                chain.action(),
                chain.payload(),
                chain.profile().ttlSeconds(),
                chain.approvers(),
                new ChainRequirement(chain.profile().describe(), chain.approvers().size()),
                reason,
                emergencyBypass,
                AuditInfo.at(now),
                now);

        idempotencyCache.record(decision, now);
        if (config.isRevokeOnTtlExpire() && decision.ttlSeconds() > 0) {
            grantRegistry.register(new ApprovalGrant(decision.approvalKey(), decision.action(),
                    decision.payload(), now, decision.ttlSeconds()));
        }

        approvalMetrics.recordDecision(decision);
        approvalMetrics.recordLeadTime(now - chain.createdAt());
        metricsConfig.updateLiveGrantCount(grantRegistry.size());

        log.info("Action APPROVED: key={}, action={}, approvers={}, requirement={}{}",
                decision.approvalKey(), decision.action(),
                decision.approvers().stream().map(Approver::identity).toList(),
                decision.chain().required(), emergencyBypass ? " (emergency bypass)" : "");

        fanOut(decision);
        return decision;
    }

    public RejectedDecision reject(String approvalKey, String action, List<RejectionReason> reasons,
                                   List<Approver> approvers, long now) {
        RejectedDecision decision = new RejectedDecision(approvalKey, action, reasons, approvers,
                AuditInfo.at(now), now);

        idempotencyCache.record(decision, now);
        approvalMetrics.recordDecision(decision);

        log.info("Action REJECTED: key={}, action={}, reasons={}", approvalKey, action,
                reasons.stream().map(RejectionReason::getCode).toList());

        fanOut(decision);
        return decision;
    }

    /**
     * Publish the current state of an accumulating chain. Never cached.
     */
    public PendingDecision pending(ApprovalChain chain, long now) {
        PendingDecision decision = PendingDecision.of(chain, now);
        approvalMetrics.recordDecision(decision);
        log.debug("Approval pending: key={}, received={}/{}", chain.approvalKey(),
                decision.received().size(), decision.needed().quorum());
        publisher.publish(decision);
        return decision;
    }

    /**
     * Withdraw an approval. The key's cached decision and live grant go with it.
     */
    public RevokedDecision revoke(String approvalKey, RevocationReason reason, Rollback rollback, long now) {
        RevokedDecision decision = new RevokedDecision(approvalKey, reason, rollback, now);

        idempotencyCache.evict(approvalKey);
        grantRegistry.remove(approvalKey);
        approvalMetrics.recordDecision(decision);
        metricsConfig.updateLiveGrantCount(grantRegistry.size());

        log.info("Approval REVOKED: key={}, reason={}, rollback={}", approvalKey, reason.getCode(),
                rollback != null ? rollback.event() : "none");

        fanOut(decision);
        return decision;
    }

    private void fanOut(Decision decision) {
        publisher.publish(decision);
        try {
            decisionRepository.save(decision);
            metricsConfig.recordDecisionLogWrite("success");
        } catch (Exception e) {
            metricsConfig.recordDecisionLogWrite("error");
            log.error("Decision log write failed for {} ({}): {}",
                    decision.approvalKey(), decision.type().getTopic(), e.getMessage(), e);
        }
    }
}
