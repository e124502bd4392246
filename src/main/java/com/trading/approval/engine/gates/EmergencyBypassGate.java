package com.trading.approval.engine.gates;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.engine.GateContext;
import com.trading.approval.engine.GateEvaluator;
import com.trading.approval.engine.GateOutcome;
import com.trading.approval.engine.GateType;
import com.trading.approval.model.ApprovalRequest;
import com.trading.approval.model.EnvironmentSnapshot;
import org.springframework.stereotype.Component;

/**
 * During an active emergency stop, a globally scoped protective action is approved on the
 * requester's word alone. Anything else passes through to normal accumulation.
 */
@Component
public class EmergencyBypassGate implements GateEvaluator {

    private final ApprovalGatewayConfig config;

    public EmergencyBypassGate(ApprovalGatewayConfig config) {
        this.config = config;
    }

    @Override
    public GateType getGateType() {
        return GateType.EMERGENCY_BYPASS;
    }

    @Override
    public GateOutcome evaluate(ApprovalRequest request, GateContext context) {
        EnvironmentSnapshot environment = context.getEnvironment();
        if (!environment.isEmergencyStopActive()) {
            return GateOutcome.pass(GateType.EMERGENCY_BYPASS);
        }

        ApprovalGatewayConfig.Rules rules = config.getRules();
        if (!rules.getEmergencyBypassActions().contains(request.getAction())) {
            return GateOutcome.pass(GateType.EMERGENCY_BYPASS);
        }

        Object scope = request.getPayload().get(rules.getEmergencyScopeKey());
        if (scope == null || !rules.getEmergencyScopeValue().equals(String.valueOf(scope))) {
            return GateOutcome.pass(GateType.EMERGENCY_BYPASS);
        }

        return GateOutcome.bypass(GateType.EMERGENCY_BYPASS,
                "Emergency bypass: " + environment.emergencyStop().reason());
    }
}
