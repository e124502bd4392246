package com.trading.approval.model;

public enum RequestSource {
    OPERATOR_DECISION,
    MANUAL_REQUEST
}
