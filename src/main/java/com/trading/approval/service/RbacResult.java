package com.trading.approval.service;

import com.trading.approval.model.RejectionReason;

public record RbacResult(boolean valid, RejectionReason reason, String detail) {

    public static RbacResult ok() {
        return new RbacResult(true, null, null);
    }

    public static RbacResult denied(RejectionReason reason, String detail) {
        return new RbacResult(false, reason, detail);
    }
}
