package com.trading.approval.model.event;

import com.trading.approval.model.BoundsCheckResult;
import com.trading.approval.model.BoundsSeverity;
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
@Schema(description = "Result of a confirmation bounds check (topic bounds.check.result)")
public class BoundsCheckResultEvent implements InboundEvent {

    @Schema(description = "Bounds check identifier", example = "bounds-aggr-0042")
    private String checkId;

    @Schema(description = "Whether every bound held", example = "true")
    private Boolean ok;

    @Schema(description = "Severity of violations, if any", example = "soft")
    private BoundsSeverity severity;

    @Schema(description = "Violated bounds, free form")
    private List<Object> violations;

    @Override
    public InboundTopic topic() {
        return InboundTopic.BOUNDS_CHECK_RESULT;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (InboundEvent.isBlank(checkId)) problems.add("checkId is required");
        if (ok == null) problems.add("ok is required");
        if (violations == null) problems.add("violations is required");
        return problems;
    }

    public BoundsCheckResult toResult(long recordedAt) {
        return new BoundsCheckResult(checkId, ok, severity, violations, recordedAt);
    }
}
