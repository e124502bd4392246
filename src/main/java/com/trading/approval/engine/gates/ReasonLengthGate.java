package com.trading.approval.engine.gates;

import com.trading.approval.engine.GateContext;
import com.trading.approval.engine.GateEvaluator;
import com.trading.approval.engine.GateOutcome;
import com.trading.approval.engine.GateType;
import com.trading.approval.model.ApprovalRequest;
import com.trading.approval.model.RejectionReason;
import org.springframework.stereotype.Component;

/**
 * Requires a justification of at least the profile's minimum length. Surrounding whitespace
 * does not count.
 */
@Component
public class ReasonLengthGate implements GateEvaluator {

    @Override
    public GateType getGateType() {
        return GateType.REASON_LENGTH;
    }

    @Override
    public GateOutcome evaluate(ApprovalRequest request, GateContext context) {
        int required = context.getProfile().minReasonChars();
        if (required <= 0) {
            return GateOutcome.pass(GateType.REASON_LENGTH);
        }

        int length = request.getReason() == null ? 0 : request.getReason().trim().length();
        if (length >= required) {
            return GateOutcome.pass(GateType.REASON_LENGTH);
        }

        return GateOutcome.fail(GateType.REASON_LENGTH, RejectionReason.REASON_TOO_SHORT,
                String.format("Reason has %d characters, %d required", length, required));
    }
}
