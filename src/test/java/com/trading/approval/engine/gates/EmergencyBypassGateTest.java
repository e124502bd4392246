package com.trading.approval.engine.gates;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.engine.GateContext;
import com.trading.approval.engine.GateOutcome;
import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.EmergencyStop;
import com.trading.approval.model.EnvironmentSnapshot;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.trading.approval.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class EmergencyBypassGateTest {

    private final EmergencyBypassGate gate = new EmergencyBypassGate(new ApprovalGatewayConfig());

    private GateContext context(boolean stopActive) {
        EnvironmentSnapshot environment = stopActive
                ? EnvironmentSnapshot.INITIAL.withEmergencyStop(new EmergencyStop(true, "Feed outage", NOW))
                : EnvironmentSnapshot.INITIAL;
        return GateContext.builder()
                .policy(standardPolicy())
                .environment(environment)
                .profile(ApprovalProfile.dual(300))
                .now(NOW)
                .build();
    }

    @Test
    void activeStop_globalHalt_bypasses() {
        GateOutcome outcome = gate.evaluate(request("k1", "halt_entry", Map.of("scope", "global"),
                requester("alice", "ops"), "Stop"), context(true));

        assertThat(outcome.bypassed()).isTrue();
        assertThat(outcome.detail()).isEqualTo("Emergency bypass: Feed outage");
    }

    @Test
    void inactiveStop_neverBypasses() {
        GateOutcome outcome = gate.evaluate(request("k1", "halt_entry", Map.of("scope", "global"),
                requester("alice", "ops"), "Stop"), context(false));

        assertThat(outcome.bypassed()).isFalse();
    }

    @Test
    void nonProtectiveAction_neverBypasses() {
        GateOutcome outcome = gate.evaluate(request("k1", "failover", Map.of("scope", "global"),
                requester("alice", "ops"), "Move"), context(true));

        assertThat(outcome.bypassed()).isFalse();
    }

    @Test
    void nonGlobalScope_neverBypasses() {
        GateOutcome outcome = gate.evaluate(request("k1", "halt_entry", Map.of("scope", "BTC-USD"),
                requester("alice", "ops"), "Stop"), context(true));

        assertThat(outcome.bypassed()).isFalse();
    }
}
