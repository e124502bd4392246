package com.trading.approval.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Authenticated submitter of a single approval request.
 */
@Schema(description = "Identity, roles and signature of the party submitting a request")
public record Requester(
        @Schema(description = "Operator or service identity", example = "ops.alice") String identity,
        @Schema(description = "Roles held by the identity", example = "[\"risk_officer\"]") List<String> roles,
        @Schema(description = "Opaque request signature") String signature) {

    public Requester {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public Approver toApprover(long timestamp) {
        return new Approver(identity, roles, timestamp);
    }

    @Override
    public String toString() {
        return "Requester[identity=" + identity + ", roles=" + roles + "]";
    }
}
