package com.trading.approval.engine;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.config.ApprovalInfrastructureConfig;
import com.trading.approval.config.MetricsConfig;
import com.trading.approval.engine.gates.AllowlistGate;
import com.trading.approval.engine.gates.BoundsFreshnessGate;
import com.trading.approval.engine.gates.EmergencyBypassGate;
import com.trading.approval.engine.gates.RbacGate;
import com.trading.approval.engine.gates.ReasonLengthGate;
import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.EmergencyStop;
import com.trading.approval.model.EnvironmentSnapshot;
import com.trading.approval.model.PolicySnapshot;
import com.trading.approval.model.RejectionReason;
import com.trading.approval.service.GatewayException;
import com.trading.approval.service.PresenceSignatureVerifier;
import com.trading.approval.service.ProfileResolver;
import com.trading.approval.service.RbacValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.Map;

import static com.trading.approval.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GateChainTest {

    private final ApprovalGatewayConfig config = new ApprovalGatewayConfig();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final MetricsConfig metricsConfig = new MetricsConfig(meterRegistry);
    private final ThreadPoolTaskExecutor executor = ApprovalInfrastructureConfig.verifierExecutor(1, 8);

    private GateChain gateChain;

    @BeforeEach
    void setUp() {
        gateChain = new GateChain(gates(), new ProfileResolver(config), Tracer.NOOP, metricsConfig);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private List<GateEvaluator> gates() {
        RbacValidator validator = new RbacValidator(new PresenceSignatureVerifier(), executor, config);
        return List.of(new RbacGate(validator), new ReasonLengthGate(), new BoundsFreshnessGate(config),
                new AllowlistGate(config), new EmergencyBypassGate(config));
    }

    @Test
    void constructor_missingGate_fails() {
        assertThatThrownBy(() -> new GateChain(List.of(new ReasonLengthGate()), new ProfileResolver(config),
                Tracer.NOOP, metricsConfig))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("RBAC");
    }

    @Test
    void evaluate_allGatesPass_returnsResolvedProfile() {
        GateVerdict verdict = gateChain.evaluate(request("k1", "halt_entry", requester("alice", "ops"), "Stop"),
                standardPolicy(), EnvironmentSnapshot.INITIAL, NOW);

        assertThat(verdict.status()).isEqualTo(GateVerdict.Status.PASSED);
        assertThat(verdict.profile().describe()).isEqualTo("dual(2/2)");
    }

    @Test
    void evaluate_rbacFailure_shortCircuitsLaterGates() {
        GateVerdict verdict = gateChain.evaluate(
                request("k1", "aggressive_overrides", requester("eve", "viewer"), "short"),
                standardPolicy(), EnvironmentSnapshot.INITIAL, NOW);

        assertThat(verdict.isRejected()).isTrue();
        assertThat(verdict.reasons()).containsExactly(RejectionReason.FORBIDDEN);
        assertThat(verdict.profile()).isNull();
    }

    @Test
    void evaluate_jointGatesReportEveryFailure() {
        GateVerdict verdict = gateChain.evaluate(
                request("k1", "aggressive_overrides", requester("alice", "risk_officer"), "short"),
                standardPolicy(), EnvironmentSnapshot.INITIAL, NOW);

        assertThat(verdict.reasons())
                .containsExactly(RejectionReason.REASON_TOO_SHORT, RejectionReason.BOUNDS_NOT_FRESH);
        assertThat(verdict.failures()).hasSize(2);
        assertThat(meterRegistry.counter("approval.gate.failures", "reason", "ReasonTooShort").count())
                .isEqualTo(1.0);
    }

    @Test
    void evaluate_unknownAction_rejected() {
        PolicySnapshot policy = new PolicySnapshot(Map.of("admin", List.of("reboot_world")), Map.of(), NOW);

        GateVerdict verdict = gateChain.evaluate(request("k1", "reboot_world", requester("root", "admin"), "Why"),
                policy, EnvironmentSnapshot.INITIAL, NOW);

        assertThat(verdict.reasons()).containsExactly(RejectionReason.UNKNOWN_ACTION);
    }

    @Test
    void evaluate_chainProfileTakesPrecedenceOverPolicy() {
        PolicySnapshot policy = new PolicySnapshot(Map.of("admin", List.of("reboot_world")), Map.of(), NOW);
        ApprovalProfile snapshot = ApprovalProfile.quorum(2, 3, 600);

        GateVerdict verdict = gateChain.evaluate(request("k1", "reboot_world", requester("root", "admin"), "Why"),
                policy, EnvironmentSnapshot.INITIAL, NOW, snapshot);

        assertThat(verdict.status()).isEqualTo(GateVerdict.Status.PASSED);
        assertThat(verdict.profile()).isEqualTo(snapshot);
    }

    @Test
    void evaluate_emergencyBypassOnlyWhenOtherGatesPass() {
        EnvironmentSnapshot stopped = EnvironmentSnapshot.INITIAL
                .withEmergencyStop(new EmergencyStop(true, "Venue meltdown", NOW));

        GateVerdict bypass = gateChain.evaluate(
                request("k1", "halt_entry", Map.of("scope", "global"), requester("alice", "ops"), "Stop"),
                standardPolicy(), stopped, NOW);
        assertThat(bypass.isBypass()).isTrue();
        assertThat(bypass.bypassReason()).isEqualTo("Emergency bypass: Venue meltdown");

        GateVerdict forbidden = gateChain.evaluate(
                request("k2", "halt_entry", Map.of("scope", "global"), requester("eve", "viewer"), "Stop"),
                standardPolicy(), stopped, NOW);
        assertThat(forbidden.isRejected()).isTrue();
    }

    @Test
    void evaluate_gateThrowing_surfacesAsGatewayException() {
        config.getRules().setTargetParameterKeys(null);

        assertThatThrownBy(() -> gateChain.evaluate(
                request("k1", "failover", Map.of("to", "x"), requester("alice", "ops"), "Move"),
                policyWithProfiles(Map.of("failover", ApprovalProfile.dual(300).withAllowlist(List.of("y")))),
                EnvironmentSnapshot.INITIAL, NOW))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("ALLOWLIST");
    }
}
