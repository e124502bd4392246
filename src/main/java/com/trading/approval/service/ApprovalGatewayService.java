package com.trading.approval.service;

import com.trading.approval.config.MetricsConfig;
import com.trading.approval.engine.ApprovalChainBuilder;
import com.trading.approval.engine.GateChain;
import com.trading.approval.engine.GateOutcome;
import com.trading.approval.engine.GateType;
import com.trading.approval.engine.GateVerdict;
import com.trading.approval.engine.KeyedLocks;
import com.trading.approval.model.AlertLevel;
import com.trading.approval.model.ApprovalChain;
import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.ApprovalRequest;
import com.trading.approval.model.ApprovedDecision;
import com.trading.approval.model.Approver;
import com.trading.approval.model.ChainStatus;
import com.trading.approval.model.Decision;
import com.trading.approval.model.PendingDecision;
import com.trading.approval.model.RejectionReason;
import com.trading.approval.model.RevocationReason;
import com.trading.approval.model.RevokedDecision;
import com.trading.approval.model.Rollback;
import com.trading.approval.repository.ApprovalGrantRegistry;
import com.trading.approval.repository.EnvironmentStateTracker;
import com.trading.approval.repository.IdempotencyCache;
import com.trading.approval.repository.PolicyStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for approval requests and revocations.
 *
 * Every operation on an approval key runs under that key's lock, so replay, gate evaluation
 * and the chain fold for one key are serialized in arrival order.
 */
@Service
public class ApprovalGatewayService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGatewayService.class);

    private final KeyedLocks keyedLocks;
    private final IdempotencyCache idempotencyCache;
    private final ApprovalGrantRegistry grantRegistry;
    private final ApprovalChainBuilder chainBuilder;
    private final GateChain gateChain;
    private final PolicyStore policyStore;
    private final EnvironmentStateTracker environmentTracker;
    private final DecisionEmitter emitter;
    private final ApprovalAlertService alertService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ApprovalGatewayService(KeyedLocks keyedLocks,
                                  IdempotencyCache idempotencyCache,
                                  ApprovalGrantRegistry grantRegistry,
                                  ApprovalChainBuilder chainBuilder,
                                  GateChain gateChain,
                                  PolicyStore policyStore,
                                  EnvironmentStateTracker environmentTracker,
                                  DecisionEmitter emitter,
                                  ApprovalAlertService alertService,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.keyedLocks = keyedLocks;
        this.idempotencyCache = idempotencyCache;
        this.grantRegistry = grantRegistry;
        this.chainBuilder = chainBuilder;
        this.gateChain = gateChain;
        this.policyStore = policyStore;
        this.environmentTracker = environmentTracker;
        this.emitter = emitter;
        this.alertService = alertService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Process one approval submission and return the resulting decision: a replayed or new
     * terminal decision, or the chain's pending state.
     */
    @Observed(name = "approval.submit", contextualName = "submit-approval")
    public Decision submit(ApprovalRequest request) {
        if (request.getApprovalKey() == null || request.getApprovalKey().isBlank()) {
            throw new IllegalArgumentException("approvalKey is required");
        }
        return keyedLocks.withLock(request.getApprovalKey(), () -> process(request));
    }

    private Decision process(ApprovalRequest request) {
        long now = clock.millis();
        String key = request.getApprovalKey();

        Optional<Decision> cached = idempotencyCache.findLive(key, now);
        if (cached.isPresent()) {
            metricsConfig.recordReplay();
            log.debug("Replaying {} for {}", cached.get().type().getTopic(), key);
            return cached.get();
        }

        try {
            return evaluateAndFold(request, now);
        } catch (RuntimeException e) {
            log.error("Approval processing failed for {} ({}): {}", key, request.getAction(), e.getMessage(), e);
            Optional<ApprovalChain> discarded = chainBuilder.discard(key);
            metricsConfig.updateActiveChainCount(chainBuilder.activeCount());
            return emitter.reject(key, request.getAction(), List.of(RejectionReason.INTERNAL_ERROR),
                    withRequester(discarded.map(ApprovalChain::approvers).orElse(List.of()), request, now), now);
        }
    }

    private Decision evaluateAndFold(ApprovalRequest request, long now) {
        String key = request.getApprovalKey();
        Optional<ApprovalChain> existing = chainBuilder.find(key);

        if (existing.isPresent()) {
            ApprovalChain chain = existing.get();
            if (!chain.action().equals(request.getAction())) {
                alertService.raise(AlertLevel.WARN,
                        "Submission for " + request.getAction() + " does not match chain action " + chain.action(),
                        key, request.getAction());
                return PendingDecision.of(chain, now);
            }
            if (chain.isOverdue(now) || chain.hasApprover(request.getRequester().identity())) {
                return PendingDecision.of(chain, now);
            }
        }

        ApprovalProfile chainProfile = existing.map(ApprovalChain::profile).orElse(null);
        GateVerdict verdict = gateChain.evaluate(request, policyStore.current(), environmentTracker.current(),
                now, chainProfile);

        List<Approver> priorApprovers = existing.map(ApprovalChain::approvers).orElse(List.of());

        if (verdict.isRejected()) {
            raiseGateAlerts(request, verdict);
            chainBuilder.discard(key);
            metricsConfig.updateActiveChainCount(chainBuilder.activeCount());
            return emitter.reject(key, request.getAction(), verdict.reasons(),
                    withRequester(priorApprovers, request, now), now);
        }

        if (verdict.isBypass()) {
            alertService.raise(AlertLevel.WARN, "Emergency bypass used", key, request.getAction());
            chainBuilder.discard(key);
            metricsConfig.updateActiveChainCount(chainBuilder.activeCount());
            ApprovalProfile profile = verdict.profile();
            long createdAt = existing.map(ApprovalChain::createdAt).orElse(now);
            ApprovalChain bypassed = new ApprovalChain(key, request.getAction(), request.getPayload(),
                    request.getReason(), profile, withRequester(priorApprovers, request, now),
                    createdAt, createdAt + profile.ttlSeconds() * 1000L, ChainStatus.COMPLETE);
            return emitter.approve(bypassed, verdict.bypassReason(), true, now);
        }

        ApprovalChainBuilder.FoldResult fold = chainBuilder.fold(request, verdict.profile(), now);
        metricsConfig.updateActiveChainCount(chainBuilder.activeCount());

        return switch (fold.outcome()) {
            case COMPLETED -> emitter.approve(fold.chain(), fold.chain().reason(), false, now);
            case OPENED, APPENDED -> emitter.pending(fold.chain(), now);
            case DUPLICATE, OVERDUE -> PendingDecision.of(fold.chain(), now);
        };
    }

    private void raiseGateAlerts(ApprovalRequest request, GateVerdict verdict) {
        for (GateOutcome failure : verdict.failures()) {
            AlertLevel level = failure.gate() == GateType.ALLOWLIST ? AlertLevel.ERROR : AlertLevel.WARN;
            String message = failure.detail() != null
                    ? failure.detail()
                    : "Gate " + failure.gate() + " failed";
            alertService.raise(level, message, request.getApprovalKey(), request.getAction());
        }
    }

    private static List<Approver> withRequester(List<Approver> prior, ApprovalRequest request, long now) {
        List<Approver> approvers = new ArrayList<>(prior);
        if (request.getRequester() != null && request.getRequester().identity() != null
                && prior.stream().noneMatch(a -> a.identity().equals(request.getRequester().identity()))) {
            approvers.add(request.getRequester().toApprover(now));
        }
        return approvers;
    }

    /**
     * Explicitly revoke an approval key. An accumulating chain is discarded; an approved key
     * loses its cached decision and grant. Empty when there was nothing to revoke.
     */
    public Optional<RevokedDecision> revoke(String approvalKey, RevocationReason reason, Rollback rollback) {
        return keyedLocks.withLock(approvalKey, () -> {
            long now = clock.millis();

            if (chainBuilder.discard(approvalKey).isPresent()) {
                metricsConfig.updateActiveChainCount(chainBuilder.activeCount());
                return Optional.of(emitter.revoke(approvalKey, reason, rollback, now));
            }

            boolean approvedLive = idempotencyCache.findLive(approvalKey, now)
                    .filter(d -> d instanceof ApprovedDecision)
                    .isPresent();
            if (approvedLive || grantRegistry.find(approvalKey).isPresent()) {
                return Optional.of(emitter.revoke(approvalKey, reason, rollback, now));
            }

            log.debug("Nothing to revoke for {}", approvalKey);
            return Optional.empty();
        });
    }

    /**
     * Live cached decision for the key, else the pending state of its chain.
     */
    public Optional<Decision> currentDecision(String approvalKey) {
        long now = clock.millis();
        Optional<Decision> cached = idempotencyCache.findLive(approvalKey, now);
        if (cached.isPresent()) {
            return cached;
        }
        return chainBuilder.find(approvalKey).map(chain -> PendingDecision.of(chain, now));
    }

    public List<PendingDecision> pendingChains() {
        long now = clock.millis();
        return chainBuilder.activeChains().stream()
                .map(chain -> PendingDecision.of(chain, now))
                .toList();
    }
}
