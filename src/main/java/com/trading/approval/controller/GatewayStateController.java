package com.trading.approval.controller;

import com.trading.approval.model.EnvironmentSnapshot;
import com.trading.approval.model.GatewayEvent;
import com.trading.approval.model.PolicySnapshot;
import com.trading.approval.model.event.BoundsCheckResultEvent;
import com.trading.approval.model.event.EmergencyStopEvent;
import com.trading.approval.model.event.GuardDirectiveEvent;
import com.trading.approval.model.event.PolicySnapshotEvent;
import com.trading.approval.repository.EnvironmentStateTracker;
import com.trading.approval.repository.OutboundEventJournal;
import com.trading.approval.repository.PolicyStore;
import com.trading.approval.service.InboundEventRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/gateway")
@Tag(name = "Gateway State", description = "Policy, environment state and recently published events")
public class GatewayStateController {

    private final InboundEventRouter router;
    private final PolicyStore policyStore;
    private final EnvironmentStateTracker environmentTracker;
    private final OutboundEventJournal eventJournal;
    private final Clock clock;

    public GatewayStateController(InboundEventRouter router,
                                  PolicyStore policyStore,
                                  EnvironmentStateTracker environmentTracker,
                                  OutboundEventJournal eventJournal,
                                  Clock clock) {
        this.router = router;
        this.policyStore = policyStore;
        this.environmentTracker = environmentTracker;
        this.eventJournal = eventJournal;
        this.clock = clock;
    }

    @GetMapping("/policy")
    @Operation(summary = "Get the current policy snapshot")
    public ResponseEntity<PolicySnapshot> getPolicy() {
        return ResponseEntity.ok(policyStore.current());
    }

    @PutMapping("/policy")
    @Operation(summary = "Replace the policy snapshot",
               description = "Full replace of roles and approval profiles. Chains already open keep their profile.")
    public ResponseEntity<?> replacePolicy(@RequestBody PolicySnapshotEvent snapshot) {
        return IngestionResponses.toResponse(router.route(snapshot));
    }

    @GetMapping("/environment")
    @Operation(summary = "Get the environment state",
               description = "Guard mode (with the mode in force now), emergency stop and retained bounds checks")
    public ResponseEntity<Map<String, Object>> getEnvironment() {
        EnvironmentSnapshot snapshot = environmentTracker.current();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("guardMode", snapshot.guardMode());
        body.put("effectiveGuardMode", snapshot.effectiveGuardMode(clock.millis()));
        body.put("guardExpiresAt", snapshot.guardExpiresAt());
        body.put("emergencyStop", snapshot.emergencyStop());
        body.put("boundsChecks", snapshot.boundsChecks().values());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/environment/guard-directive")
    @Operation(summary = "Apply a guard directive")
    public ResponseEntity<?> applyGuardDirective(@RequestBody GuardDirectiveEvent directive) {
        return IngestionResponses.toResponse(router.route(directive));
    }

    @PostMapping("/environment/bounds-checks")
    @Operation(summary = "Record a bounds check result")
    public ResponseEntity<?> recordBoundsCheck(@RequestBody BoundsCheckResultEvent result) {
        return IngestionResponses.toResponse(router.route(result));
    }

    @PostMapping("/environment/emergency-stop")
    @Operation(summary = "Set or clear the emergency stop")
    public ResponseEntity<?> applyEmergencyStop(@RequestBody EmergencyStopEvent stop) {
        return IngestionResponses.toResponse(router.route(stop));
    }

    @GetMapping("/events/recent")
    @Operation(summary = "Recently published outbound events",
               description = "Newest first, optionally filtered by topic (e.g. action.approved, approval.alert)")
    public ResponseEntity<List<GatewayEvent>> getRecentEvents(@RequestParam(required = false) String topic,
                                                              @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(eventJournal.recent(topic, limit));
    }
}
