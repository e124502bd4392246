package com.trading.approval.engine;

/**
 * Gates in evaluation order.
 */
public enum GateType {
    RBAC,
    REASON_LENGTH,
    BOUNDS_FRESHNESS,
    ALLOWLIST,
    EMERGENCY_BYPASS
}
