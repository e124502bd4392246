package com.trading.approval.engine;

import com.trading.approval.model.RejectionReason;

import java.util.List;

/**
 * Result of a single gate.
 */
public record GateOutcome(GateType gate, Status status, List<RejectionReason> reasons, String detail) {

    public enum Status { PASS, FAIL, BYPASS }

    public GateOutcome {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static GateOutcome pass(GateType gate) {
        return new GateOutcome(gate, Status.PASS, List.of(), null);
    }

    public static GateOutcome fail(GateType gate, RejectionReason reason, String detail) {
        return new GateOutcome(gate, Status.FAIL, List.of(reason), detail);
    }

    public static GateOutcome bypass(GateType gate, String detail) {
        return new GateOutcome(gate, Status.BYPASS, List.of(), detail);
    }

    public boolean failed() {
        return status == Status.FAIL;
    }

    public boolean bypassed() {
        return status == Status.BYPASS;
    }
}
