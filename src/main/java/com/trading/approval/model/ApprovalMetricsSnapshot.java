package com.trading.approval.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "Periodic gateway summary (topic approval.metrics)")
public record ApprovalMetricsSnapshot(
        @Schema(description = "Chains currently accumulating") long pending,
        long approved,
        long rejected,
        long revoked,
        @Schema(description = "Terminal decisions per action") Map<String, Long> byAction,
        @Schema(description = "Average seconds from chain creation to approval") double avgLeadTimeSeconds,
        long timestamp) {
}
