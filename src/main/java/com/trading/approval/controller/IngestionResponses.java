package com.trading.approval.controller;

import com.trading.approval.service.IngestionResult;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps an ingestion result onto the HTTP contract shared by all inbound endpoints.
 */
final class IngestionResponses {

    private IngestionResponses() {
    }

    static ResponseEntity<?> toResponse(IngestionResult result) {
        if (result.isDropped()) {
            return ResponseEntity.badRequest().body(Map.of("error", String.join("; ", result.errors())));
        }
        if (result.decision() != null) {
            return ResponseEntity.ok(result.decision());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", result.status().name().toLowerCase());
        body.put("topic", result.topic().getTopic());
        if (result.status() == IngestionResult.Status.IGNORED) {
            return ResponseEntity.accepted().body(body);
        }
        return ResponseEntity.ok(body);
    }
}
