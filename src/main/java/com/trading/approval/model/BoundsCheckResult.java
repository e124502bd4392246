package com.trading.approval.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record BoundsCheckResult(
        String checkId,
        boolean ok,
        BoundsSeverity severity,
        List<Object> violations,
        long recordedAt) {

    public BoundsCheckResult {
        violations = violations == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public boolean isFreshAt(long now, long windowMillis) {
        return now - recordedAt <= windowMillis;
    }
}
