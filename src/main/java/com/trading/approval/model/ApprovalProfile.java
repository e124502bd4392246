package com.trading.approval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Named approval policy: how many distinct approvers an action needs and for how long
 * an approval attempt (and the resulting grant) stays alive.
 */
@Schema(description = "Approval profile describing the distinct-approver requirement and time window")
public record ApprovalProfile(
        @Schema(description = "Profile kind", example = "dual") ProfileKind kind,
        @Schema(description = "Distinct approvers required to complete (ignored for single)", example = "2") int quorumCount,
        @Schema(description = "Size of the eligible approver pool, reporting only", example = "2") int ofCount,
        @Schema(description = "Chain lifetime and grant lifetime in seconds", example = "300") long ttlSeconds,
        @Schema(description = "Minimum characters required in the request reason", example = "20") int minReasonChars,
        @Schema(description = "Permitted targets; empty means unrestricted") List<String> allowlist) {

    public ApprovalProfile {
        allowlist = allowlist == null ? List.of() : List.copyOf(allowlist);
    }

    public static ApprovalProfile single(long ttlSeconds, int minReasonChars) {
        return new ApprovalProfile(ProfileKind.SINGLE, 1, 1, ttlSeconds, minReasonChars, List.of());
    }

    public static ApprovalProfile dual(long ttlSeconds) {
        return new ApprovalProfile(ProfileKind.DUAL, 2, 2, ttlSeconds, 0, List.of());
    }

    public static ApprovalProfile quorum(int quorumCount, int ofCount, long ttlSeconds) {
        return new ApprovalProfile(ProfileKind.QUORUM, quorumCount, ofCount, ttlSeconds, 0, List.of());
    }

    /**
     * Distinct approvers needed for completion. ofCount never takes part in this.
     */
    @JsonIgnore
    public int requiredApprovals() {
        return kind == ProfileKind.SINGLE ? 1 : Math.max(1, quorumCount);
    }

    @JsonIgnore
    public int poolSize() {
        return Math.max(ofCount, requiredApprovals());
    }

    /**
     * Compact form used in audit output, e.g. {@code dual(2/2)}.
     */
    public String describe() {
        return kind.getCode() + "(" + requiredApprovals() + "/" + poolSize() + ")";
    }

    @JsonIgnore
    public boolean hasAllowlist() {
        return !allowlist.isEmpty();
    }

    public ApprovalProfile withTtlSeconds(long ttl) {
        return new ApprovalProfile(kind, quorumCount, ofCount, ttl, minReasonChars, allowlist);
    }

    public ApprovalProfile withAllowlist(List<String> targets) {
        return new ApprovalProfile(kind, quorumCount, ofCount, ttlSeconds, minReasonChars, targets);
    }

    /**
     * Fills in counts a policy author may leave out: dual defaults to 2-of-2,
     * a missing pool size defaults to the quorum. A quorum count of 0 reads as left out.
     */
    public ApprovalProfile normalized() {
        if (kind == null) {
            return this;
        }
        int quorum = switch (kind) {
            case SINGLE -> 1;
            case DUAL -> quorumCount > 0 ? quorumCount : 2;
            case QUORUM -> quorumCount > 0 ? quorumCount : 2;
        };
        int of = ofCount > 0 ? ofCount : quorum;
        return new ApprovalProfile(kind, quorum, of, ttlSeconds, minReasonChars, allowlist);
    }

    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        if (kind == null) {
            problems.add("kind is required");
            return problems;
        }
        if (ttlSeconds < 0) {
            problems.add("ttlSeconds must be >= 0");
        }
        if (minReasonChars < 0) {
            problems.add("minReasonChars must be >= 0");
        }
        if (kind != ProfileKind.SINGLE && quorumCount < 0) {
            problems.add("quorumCount must not be negative (0 selects the default of 2)");
        }
        if (kind != ProfileKind.SINGLE && ofCount > 0 && quorumCount > ofCount) {
            problems.add("quorumCount (" + quorumCount + ") must not exceed ofCount (" + ofCount + ")");
        }
        return problems;
    }
}
