package com.trading.approval.service;

import com.trading.approval.model.Decision;
import com.trading.approval.model.event.InboundTopic;

import java.util.List;

/**
 * What became of one inbound event.
 *
 * @param topic    null when the event could not be parsed at all
 * @param decision set when the event was an approval request that produced a decision
 * @param errors   parse or schema problems of a dropped event
 */
public record IngestionResult(Status status, InboundTopic topic, Decision decision, List<String> errors) {

    public enum Status { APPLIED, IGNORED, DROPPED }

    public IngestionResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static IngestionResult applied(InboundTopic topic) {
        return new IngestionResult(Status.APPLIED, topic, null, List.of());
    }

    public static IngestionResult decided(InboundTopic topic, Decision decision) {
        return new IngestionResult(Status.APPLIED, topic, decision, List.of());
    }

    public static IngestionResult ignored(InboundTopic topic) {
        return new IngestionResult(Status.IGNORED, topic, null, List.of());
    }

    public static IngestionResult dropped(InboundTopic topic, List<String> errors) {
        return new IngestionResult(Status.DROPPED, topic, null, errors);
    }

    public boolean isDropped() {
        return status == Status.DROPPED;
    }
}
