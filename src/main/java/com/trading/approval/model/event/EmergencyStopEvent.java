package com.trading.approval.model.event;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Emergency stop flag, full replace (topic emergency.stop)")
public class EmergencyStopEvent implements InboundEvent {

    @Schema(description = "Whether the emergency stop is in force", example = "true")
    private Boolean active;

    @Schema(description = "Why the stop was declared", example = "Exchange circuit breaker tripped")
    private String reason;

    @Override
    public InboundTopic topic() {
        return InboundTopic.EMERGENCY_STOP;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (active == null) problems.add("active is required");
        if (reason == null) problems.add("reason is required");
        return problems;
    }
}
