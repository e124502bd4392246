package com.trading.approval.service;

/**
 * Infrastructure or programming failure inside the gateway. Never crosses the gateway
 * service boundary; the affected request is rejected with an internal error instead.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
