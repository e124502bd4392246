package com.trading.approval.engine;

import com.trading.approval.model.ApprovalRequest;

/**
 * A single admission check applied to every approval request.
 * Each implementation handles one {@link GateType}.
 */
public interface GateEvaluator {

    /**
     * The gate this evaluator implements.
     */
    GateType getGateType();

    /**
     * Judge a request against the snapshots in the context.
     *
     * @param request the normalized approval request
     * @param context policy and environment snapshots plus the resolved profile
     * @return pass, fail with reasons, or bypass
     */
    GateOutcome evaluate(ApprovalRequest request, GateContext context);
}
