package com.trading.approval.controller;

import com.trading.approval.model.ApprovalMetricsSnapshot;
import com.trading.approval.model.Decision;
import com.trading.approval.model.DecisionType;
import com.trading.approval.model.PendingDecision;
import com.trading.approval.model.RevokeRequest;
import com.trading.approval.model.RevokedDecision;
import com.trading.approval.model.event.ManualApprovalRequestEvent;
import com.trading.approval.model.event.OperatorDecisionFinalEvent;
import com.trading.approval.repository.DecisionRepository;
import com.trading.approval.service.ApprovalGatewayService;
import com.trading.approval.service.ApprovalMetricsService;
import com.trading.approval.service.InboundEventRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/approvals")
@Tag(name = "Approvals", description = "Approval requests, decisions, revocation and reporting")
public class ApprovalController {

    private static final Logger log = LoggerFactory.getLogger(ApprovalController.class);

    private final InboundEventRouter router;
    private final ApprovalGatewayService gatewayService;
    private final ApprovalMetricsService metricsService;
    private final DecisionRepository decisionRepository;

    public ApprovalController(InboundEventRouter router,
                              ApprovalGatewayService gatewayService,
                              ApprovalMetricsService metricsService,
                              DecisionRepository decisionRepository) {
        this.router = router;
        this.gatewayService = gatewayService;
        this.metricsService = metricsService;
        this.decisionRepository = decisionRepository;
    }

    @PostMapping("/requests")
    @Operation(summary = "Submit a manual approval request",
               description = "Runs the gates and folds the requester into the approval chain. " +
                       "Returns the approved, rejected or pending decision.")
    public ResponseEntity<?> submitRequest(@RequestBody ManualApprovalRequestEvent request) {
        return IngestionResponses.toResponse(router.route(request));
    }

    @PostMapping("/operator-decisions")
    @Operation(summary = "Submit a final operator decision",
               description = "Accepted decisions are processed as approval requests; " +
                       "decisions with accepted=false are acknowledged with 202 and ignored.")
    public ResponseEntity<?> submitOperatorDecision(@RequestBody OperatorDecisionFinalEvent decision) {
        return IngestionResponses.toResponse(router.route(decision));
    }

    @GetMapping("/{approvalKey}")
    @Operation(summary = "Get the current decision for an approval key",
               description = "Returns the live cached Approved/Rejected decision, or the pending state of an active chain")
    public ResponseEntity<Decision> getDecision(@PathVariable String approvalKey) {
        return gatewayService.currentDecision(approvalKey)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{approvalKey}/revoke")
    @Operation(summary = "Revoke an approval",
               description = "Reason is ManualRevoke (default) or Superseded. An optional rollback " +
                       "{event, params} is attached to the approval.revoked event.")
    public ResponseEntity<?> revoke(@PathVariable String approvalKey,
                                    @RequestBody(required = false) RevokeRequest body) {
        RevokeRequest request = body != null ? body : new RevokeRequest();
        List<String> problems = request.validate();
        if (!problems.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", String.join("; ", problems)));
        }

        Optional<RevokedDecision> revoked = gatewayService.revoke(approvalKey, request.revocationReason(),
                request.getRollback());
        if (revoked.isEmpty()) {
            log.debug("Revoke requested for {} with nothing live", approvalKey);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(revoked.get());
    }

    @GetMapping("/pending")
    @Operation(summary = "List accumulating approval chains")
    public ResponseEntity<List<PendingDecision>> getPending() {
        return ResponseEntity.ok(gatewayService.pendingChains());
    }

    @GetMapping("/history")
    @Operation(summary = "Query the decision log",
               description = "Most recent decisions first. Filters: action, type (approved, rejected, revoked), limit.")
    public ResponseEntity<List<Decision>> getHistory(@RequestParam(required = false) String action,
                                                     @RequestParam(required = false) String type,
                                                     @RequestParam(defaultValue = "100") int limit) {
        DecisionType decisionType = null;
        if (type != null && !type.isBlank()) {
            try {
                decisionType = DecisionType.valueOf(type.toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown decision type: " + type);
            }
        }
        return ResponseEntity.ok(decisionRepository.findRecent(action, decisionType, limit));
    }

    @GetMapping("/stats")
    @Operation(summary = "Current approval metrics summary")
    public ResponseEntity<ApprovalMetricsSnapshot> getStats() {
        return ResponseEntity.ok(metricsService.snapshot());
    }
}
