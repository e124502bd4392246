package com.trading.approval.engine.gates;

import com.trading.approval.engine.GateContext;
import com.trading.approval.engine.GateEvaluator;
import com.trading.approval.engine.GateOutcome;
import com.trading.approval.engine.GateType;
import com.trading.approval.model.ApprovalRequest;
import com.trading.approval.service.RbacResult;
import com.trading.approval.service.RbacValidator;
import org.springframework.stereotype.Component;

/**
 * Signature and role authorization of the submitting party. Evaluated for every
 * approver, never cached.
 */
@Component
public class RbacGate implements GateEvaluator {

    private final RbacValidator rbacValidator;

    public RbacGate(RbacValidator rbacValidator) {
        this.rbacValidator = rbacValidator;
    }

    @Override
    public GateType getGateType() {
        return GateType.RBAC;
    }

    @Override
    public GateOutcome evaluate(ApprovalRequest request, GateContext context) {
        RbacResult result = rbacValidator.validate(request.getRequester(), request.getAction(), context.getPolicy());
        if (result.valid()) {
            return GateOutcome.pass(GateType.RBAC);
        }
        return GateOutcome.fail(GateType.RBAC, result.reason(), result.detail());
    }
}
