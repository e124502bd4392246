package com.trading.approval.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Explicit revocation of a live approval")
public class RevokeRequest {

    @Schema(description = "ManualRevoke (default) or Superseded", example = "Superseded")
    private String reason;

    @Schema(description = "Compensating event attached to approval.revoked")
    private Rollback rollback;

    public RevocationReason revocationReason() {
        return reason == null || reason.isBlank() ? RevocationReason.MANUAL_REVOKE : RevocationReason.fromCode(reason);
    }

    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        try {
            if (revocationReason() == RevocationReason.TTL_EXPIRED) {
                problems.add("TtlExpired revocations are issued by the gateway only");
            }
        } catch (IllegalArgumentException e) {
            problems.add(e.getMessage());
        }
        if (rollback != null && (rollback.event() == null || rollback.event().isBlank())) {
            problems.add("rollback.event is required");
        }
        return problems;
    }
}
