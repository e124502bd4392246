package com.trading.approval.model;

/**
 * Envelope for everything the gateway publishes downstream.
 */
public record GatewayEvent(String topic, Object payload, long publishedAt) {
}
