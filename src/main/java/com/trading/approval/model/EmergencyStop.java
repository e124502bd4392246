package com.trading.approval.model;

public record EmergencyStop(boolean active, String reason, long updatedAt) {

    public static final EmergencyStop INACTIVE = new EmergencyStop(false, "", 0L);
}
