package com.trading.approval.engine;

import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.RejectionReason;

import java.util.List;

/**
 * Combined verdict of the gate chain for one request.
 *
 * @param profile      effective profile; null when RBAC or profile resolution failed
 * @param reasons      rejection reasons in gate order, empty unless rejected
 * @param failures     failing gate outcomes, for alerting
 * @param bypassReason system reason when an emergency bypass applies
 */
public record GateVerdict(Status status, ApprovalProfile profile, List<RejectionReason> reasons,
                          List<GateOutcome> failures, String bypassReason) {

    public enum Status { PASSED, REJECTED, BYPASS }

    public GateVerdict {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static GateVerdict passed(ApprovalProfile profile) {
        return new GateVerdict(Status.PASSED, profile, List.of(), List.of(), null);
    }

    public static GateVerdict rejected(ApprovalProfile profile, List<GateOutcome> failures) {
        List<RejectionReason> reasons = failures.stream()
                .flatMap(f -> f.reasons().stream())
                .distinct()
                .toList();
        return new GateVerdict(Status.REJECTED, profile, reasons, failures, null);
    }

    public static GateVerdict bypass(ApprovalProfile profile, String reason) {
        return new GateVerdict(Status.BYPASS, profile, List.of(), List.of(), reason);
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    public boolean isBypass() {
        return status == Status.BYPASS;
    }
}
