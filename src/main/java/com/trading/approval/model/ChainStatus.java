package com.trading.approval.model;

public enum ChainStatus {
    ACCUMULATING,
    COMPLETE,
    EXPIRED
}
