package com.trading.approval.model.event;

import com.trading.approval.model.GuardMode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Guard mode directive, full replace (topic environment.guard.directive)")
public class GuardDirectiveEvent implements InboundEvent {

    @Schema(description = "Guard mode", example = "halt_entry")
    private GuardMode mode;

    @Schema(description = "When the directive lapses", example = "2025-02-18T14:30:00Z")
    private Instant expiresAt;

    @Override
    public InboundTopic topic() {
        return InboundTopic.GUARD_DIRECTIVE;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (mode == null) problems.add("mode is required");
        if (expiresAt == null) problems.add("expiresAt is required");
        return problems;
    }
}
