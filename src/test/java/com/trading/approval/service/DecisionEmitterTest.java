package com.trading.approval.service;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.config.MetricsConfig;
import com.trading.approval.model.ApprovalChain;
import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.ApprovedDecision;
import com.trading.approval.model.Approver;
import com.trading.approval.model.ChainStatus;
import com.trading.approval.model.PendingDecision;
import com.trading.approval.model.RejectedDecision;
import com.trading.approval.model.RejectionReason;
import com.trading.approval.model.RevocationReason;
import com.trading.approval.model.RevokedDecision;
import com.trading.approval.model.Rollback;
import com.trading.approval.repository.ApprovalGrantRegistry;
import com.trading.approval.repository.DecisionRepository;
import com.trading.approval.repository.IdempotencyCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.trading.approval.testutil.TestDataFactory.NOW;
import static com.trading.approval.testutil.TestDataFactory.request;
import static com.trading.approval.testutil.TestDataFactory.requester;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DecisionEmitterTest {

    @Mock private DecisionRepository decisionRepository;
    @Mock private DecisionEventPublisher publisher;
    @Mock private ApprovalMetricsService approvalMetrics;
    @Mock private MetricsConfig metricsConfig;

    private final ApprovalGatewayConfig config = new ApprovalGatewayConfig();
    private final IdempotencyCache cache = new IdempotencyCache(config);
    private final ApprovalGrantRegistry grants = new ApprovalGrantRegistry();

    private DecisionEmitter emitter;

    @BeforeEach
    void setUp() {
        emitter = new DecisionEmitter(cache, grants, decisionRepository, publisher, approvalMetrics,
                metricsConfig, config);
    }

    private ApprovalChain completeChain(long ttlSeconds) {
        List<Approver> approvers = List.of(
                new Approver("ops.alice", List.of("ops"), NOW - 20_000),
                new Approver("ops.bob", List.of("ops"), NOW));
        return new ApprovalChain("halt-1", "halt_entry", Map.of("scope", "venue"), "Venue feed stale",
                ApprovalProfile.dual(ttlSeconds), approvers, NOW - 20_000, NOW - 20_000 + ttlSeconds * 1000,
                ChainStatus.COMPLETE);
    }

    @Test
    void approve_cachesRegistersGrantAndPublishes() {
        ApprovedDecision decision = emitter.approve(completeChain(300), "Venue feed stale", false, NOW);

        assertThat(decision.approvers()).hasSize(2);
        assertThat(decision.chain().collected()).isEqualTo(2);
        assertThat(cache.findLive("halt-1", NOW)).contains(decision);
        assertThat(grants.find("halt-1").orElseThrow().revokeDueAt()).isEqualTo(NOW + 300_000);
        verify(publisher).publish(decision);
        verify(decisionRepository).save(decision);
        verify(approvalMetrics).recordLeadTime(20_000);
        verify(metricsConfig).recordDecisionLogWrite("success");
    }

    @Test
    void approve_zeroTtl_registersNoGrant() {
        emitter.approve(completeChain(0), "Stop", false, NOW);

        assertThat(grants.size()).isZero();
    }

    @Test
    void reject_cachesAndPublishes() {
        RejectedDecision decision = emitter.reject("halt-1", "halt_entry",
                List.of(RejectionReason.FORBIDDEN), List.of(), NOW);

        assertThat(cache.findLive("halt-1", NOW)).contains(decision);
        verify(publisher).publish(decision);
        verify(approvalMetrics).recordDecision(decision);
    }

    @Test
    void pending_publishedButNeverCachedOrLogged() {
        ApprovalChain chain = ApprovalChain.open(
                request("halt-1", "halt_entry", requester("ops.alice", "ops"), "Stop"), ApprovalProfile.dual(300), NOW);

        PendingDecision pending = emitter.pending(chain, NOW);

        assertThat(cache.findLive("halt-1", NOW)).isEmpty();
        verify(publisher).publish(pending);
        verify(decisionRepository, never()).save(any());
    }

    @Test
    void revoke_evictsCacheAndGrant() {
        emitter.approve(completeChain(300), "Venue feed stale", false, NOW);
        Rollback rollback = new Rollback("resume_entry", Map.of("scope", "venue"));

        RevokedDecision revoked = emitter.revoke("halt-1", RevocationReason.MANUAL_REVOKE, rollback, NOW + 1_000);

        assertThat(revoked.rollback()).isEqualTo(rollback);
        assertThat(cache.findLive("halt-1", NOW + 1_000)).isEmpty();
        assertThat(grants.find("halt-1")).isEmpty();
        verify(publisher).publish(revoked);
    }

    @Test
    void decisionLogFailure_isCountedNotThrown() {
        doThrow(new IllegalStateException("aerospike down")).when(decisionRepository).save(any());

        RejectedDecision decision = emitter.reject("halt-1", "halt_entry",
                List.of(RejectionReason.FORBIDDEN), List.of(), NOW);

        assertThat(decision).isNotNull();
        verify(metricsConfig).recordDecisionLogWrite("error");
    }
}
