package com.trading.approval.engine.gates;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.engine.GateContext;
import com.trading.approval.engine.GateEvaluator;
import com.trading.approval.engine.GateOutcome;
import com.trading.approval.engine.GateType;
import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.ApprovalRequest;
import com.trading.approval.model.RejectionReason;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Restricts the action's target to an allowlist. The profile's allowlist wins over the
 * configured default for the action; an empty list leaves the target unrestricted, as does
 * a payload without a target parameter.
 */
@Component
public class AllowlistGate implements GateEvaluator {

    private final ApprovalGatewayConfig config;

    public AllowlistGate(ApprovalGatewayConfig config) {
        this.config = config;
    }

    @Override
    public GateType getGateType() {
        return GateType.ALLOWLIST;
    }

    @Override
    public GateOutcome evaluate(ApprovalRequest request, GateContext context) {
        List<String> allowlist = effectiveAllowlist(request.getAction(), context.getProfile());
        if (allowlist.isEmpty()) {
            return GateOutcome.pass(GateType.ALLOWLIST);
        }

        String target = findTarget(request);
        if (target == null || allowlist.contains(target)) {
            return GateOutcome.pass(GateType.ALLOWLIST);
        }

        return GateOutcome.fail(GateType.ALLOWLIST, RejectionReason.ALLOWLIST_VIOLATION,
                "Target '" + target + "' is not allowlisted for " + request.getAction());
    }

    private List<String> effectiveAllowlist(String action, ApprovalProfile profile) {
        if (profile != null && profile.hasAllowlist()) {
            return profile.allowlist();
        }
        List<String> fallback = config.getDefaults().getAllowlists().get(action);
        return fallback != null ? fallback : List.of();
    }

    private String findTarget(ApprovalRequest request) {
        for (String key : config.getRules().getTargetParameterKeys()) {
            Object value = request.getPayload().get(key);
            if (value != null) {
                return String.valueOf(value);
            }
        }
        return null;
    }
}
