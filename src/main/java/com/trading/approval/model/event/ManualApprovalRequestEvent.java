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
@Schema(description = "Manual request or co-signature for a high-risk action (topic manual.approval.request)")
public class ManualApprovalRequestEvent implements InboundEvent {

    @Schema(description = "Correlates every submission for one authorization", example = "failover-eu-2025-02-18")
    private String approvalKey;

    @Schema(description = "Action to authorize", example = "failover")
    private String action;

    @Schema(description = "Action parameters, e.g. {\"to\": \"eu-west-2\"}")
    private Map<String, Object> payload;

    @Schema(description = "Authenticated requester or co-approver")
    private Requester requestedBy;

    @Schema(description = "Justification for the action", example = "Primary venue gateway unreachable for 3 minutes")
    private String reason;

    @Override
    public InboundTopic topic() {
        return InboundTopic.MANUAL_APPROVAL_REQUEST;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (InboundEvent.isBlank(approvalKey)) problems.add("approvalKey is required");
        if (InboundEvent.isBlank(action)) problems.add("action is required");
        if (payload == null) problems.add("payload is required");
        if (reason == null) problems.add("reason is required");
        RequesterChecks.check("requestedBy", requestedBy, problems);
        return problems;
    }

    public ApprovalRequest toApprovalRequest() {
        return ApprovalRequest.builder()
                .approvalKey(approvalKey)
                .action(action)
                .payload(payload)
                .requester(requestedBy)
                .reason(reason)
                .source(RequestSource.MANUAL_REQUEST)
                .build();
    }
}
