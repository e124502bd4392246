package com.trading.approval.controller;

import com.trading.approval.service.InboundEventRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/events")
@Tag(name = "Events", description = "Tagged inbound event envelope for every inbound topic")
public class EventController {

    private final InboundEventRouter router;

    public EventController(InboundEventRouter router) {
        this.router = router;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Ingest an inbound event",
               description = "The 'event' property selects the topic. Approval topics return the resulting decision; " +
                       "malformed or invalid events are rejected with 400 and change nothing.")
    public ResponseEntity<?> ingest(@RequestBody String body) {
        return IngestionResponses.toResponse(router.route(body));
    }
}
