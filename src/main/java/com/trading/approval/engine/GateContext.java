package com.trading.approval.engine;

import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.EnvironmentSnapshot;
import com.trading.approval.model.PolicySnapshot;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshots a single request is judged against. Every gate of one evaluation sees the same
 * policy and environment, even if either is swapped meanwhile.
 */
@Value
@Builder(toBuilder = true)
public class GateContext {
    PolicySnapshot policy;
    EnvironmentSnapshot environment;

    // Resolved after RBAC; null while RBAC itself runs.
    ApprovalProfile profile;

    long now;
}
