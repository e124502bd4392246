package com.trading.approval.model.event;

import com.trading.approval.model.ApprovalRequest;
import com.trading.approval.model.RequestSource;
import com.trading.approval.model.Requester;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Final operator decision on a prompt (topic operator.decision.final)")
public class OperatorDecisionFinalEvent implements InboundEvent {

    static final String DEFAULT_RATIONALE = "Operator decision";

    @Schema(description = "Prompt the operator answered", example = "prompt-7f3a")
    private String promptId;

    @Schema(description = "Operator decision identifier", example = "dec-0192")
    private String decisionId;

    @Schema(description = "Only accepted decisions are forwarded for approval", example = "true")
    private Boolean accepted;

    @Schema(description = "Operator rationale; defaults to 'Operator decision'")
    private String rationale;

    @Schema(description = "Optional TTL override for the approval profile, seconds", example = "120")
    private Long ttlSec;

    private Context context;

    @Schema(description = "Authenticated operator")
    private Requester auth;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Context {
        @Schema(example = "halt_entry")
        private String action;
        private Map<String, Object> payload;
        @Schema(example = "halt-2025-02-18-001")
        private String approvalKey;
    }

    @Override
    public InboundTopic topic() {
        return InboundTopic.OPERATOR_DECISION_FINAL;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (InboundEvent.isBlank(promptId)) problems.add("promptId is required");
        if (InboundEvent.isBlank(decisionId)) problems.add("decisionId is required");
        if (accepted == null) problems.add("accepted is required");
        if (ttlSec != null && ttlSec < 0) problems.add("ttlSec must be >= 0");
        if (context == null) {
            problems.add("context is required");
        } else {
            if (InboundEvent.isBlank(context.getAction())) problems.add("context.action is required");
            if (InboundEvent.isBlank(context.getApprovalKey())) problems.add("context.approvalKey is required");
            if (context.getPayload() == null) problems.add("context.payload is required");
        }
        RequesterChecks.check("auth", auth, problems);
        return problems;
    }

    public ApprovalRequest toApprovalRequest() {
        return ApprovalRequest.builder()
                .approvalKey(context.getApprovalKey())
                .action(context.getAction())
                .payload(context.getPayload())
                .requester(auth)
                .reason(rationale != null ? rationale : DEFAULT_RATIONALE)
                .ttlOverrideSeconds(ttlSec)
                .source(RequestSource.OPERATOR_DECISION)
                .build();
    }
}
