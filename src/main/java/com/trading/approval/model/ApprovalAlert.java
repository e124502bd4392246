package com.trading.approval.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "Gate violation or override worth surfacing to operators (topic approval.alert)")
public record ApprovalAlert(AlertLevel level, String message, Map<String, Object> context, long timestamp) {

    public ApprovalAlert {
        context = context == null ? Map.of() : context;
    }
}
