package com.trading.approval.model;

/**
 * Reporting block on approvals: the requirement as text (e.g. {@code quorum(2/3)}) and
 * how many distinct approvers were collected.
 */
public record ChainRequirement(String required, int collected) {
}
