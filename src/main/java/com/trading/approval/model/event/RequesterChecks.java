package com.trading.approval.model.event;

import com.trading.approval.model.Requester;

import java.util.List;

final class RequesterChecks {

    private RequesterChecks() {}

    static void check(String field, Requester requester, List<String> problems) {
        if (requester == null) {
            problems.add(field + " is required");
            return;
        }
        if (InboundEvent.isBlank(requester.identity())) {
            problems.add(field + ".identity is required");
        }
        if (requester.roles().stream().anyMatch(InboundEvent::isBlank)) {
            problems.add(field + ".roles must not contain blank entries");
        }
        if (requester.signature() == null) {
            problems.add(field + ".signature is required");
        }
    }
}
