package com.trading.approval.engine.gates;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.engine.GateContext;
import com.trading.approval.engine.GateEvaluator;
import com.trading.approval.engine.GateOutcome;
import com.trading.approval.engine.GateType;
import com.trading.approval.model.ApprovalRequest;
import com.trading.approval.model.RejectionReason;
import org.springframework.stereotype.Component;

/**
 * Actions that move risk parameters need a recent passing bounds check.
 *
 * When the payload names a bounds check (by default under {@code boundsCheckId}) only that
 * check counts; otherwise any passing check inside the freshness window does.
 */
@Component
public class BoundsFreshnessGate implements GateEvaluator {

    private final ApprovalGatewayConfig config;

    public BoundsFreshnessGate(ApprovalGatewayConfig config) {
        this.config = config;
    }

    @Override
    public GateType getGateType() {
        return GateType.BOUNDS_FRESHNESS;
    }

    @Override
    public GateOutcome evaluate(ApprovalRequest request, GateContext context) {
        if (!config.getRules().getRequireFreshBounds().contains(request.getAction())) {
            return GateOutcome.pass(GateType.BOUNDS_FRESHNESS);
        }

        Object related = request.getPayload().get(config.getRules().getBoundsCheckIdKey());
        String checkId = related != null ? String.valueOf(related) : null;
        long windowMillis = config.getBoundsFreshnessSeconds() * 1000L;

        boolean fresh = context.getEnvironment()
                .freshPassingCheck(checkId, context.getNow(), windowMillis)
                .isPresent();
        if (fresh) {
            return GateOutcome.pass(GateType.BOUNDS_FRESHNESS);
        }

        String detail = checkId != null
                ? "Bounds check " + checkId + " is missing, failing or older than " + config.getBoundsFreshnessSeconds() + "s"
                : "No passing bounds check within " + config.getBoundsFreshnessSeconds() + "s";
        return GateOutcome.fail(GateType.BOUNDS_FRESHNESS, RejectionReason.BOUNDS_NOT_FRESH, detail);
    }
}
