package com.trading.approval.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "A distinct party whose consent was counted towards an approval chain")
public record Approver(
        @Schema(description = "Approver identity", example = "ops.alice") String identity,
        @Schema(description = "Roles the approver held when submitting") List<String> roles,
        @Schema(description = "Submission time, epoch millis", example = "1739886764000") long timestamp) {

    public Approver {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
