package com.trading.approval.engine;

import com.trading.approval.config.MetricsConfig;
import com.trading.approval.model.ApprovalProfile;
import com.trading.approval.model.ApprovalRequest;
import com.trading.approval.model.EnvironmentSnapshot;
import com.trading.approval.model.PolicySnapshot;
import com.trading.approval.model.RejectionReason;
import com.trading.approval.service.GatewayException;
import com.trading.approval.service.ProfileResolver;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the admission gates for one request in fixed order.
 *
 * <ol>
 *   <li>RBAC. A failure ends evaluation.</li>
 *   <li>Profile resolution. An action without a profile is rejected as unknown.</li>
 *   <li>Reason length, bounds freshness and allowlist. All three run and every failure is reported.</li>
 *   <li>Emergency bypass, only when everything above passed.</li>
 * </ol>
 */
@Component
public class GateChain {

    private static final Logger log = LoggerFactory.getLogger(GateChain.class);

    private static final List<GateType> JOINT_GATES =
            List.of(GateType.REASON_LENGTH, GateType.BOUNDS_FRESHNESS, GateType.ALLOWLIST);

    private final Map<GateType, GateEvaluator> evaluatorMap;
    private final ProfileResolver profileResolver;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public GateChain(List<GateEvaluator> evaluators, ProfileResolver profileResolver,
                     Tracer tracer, MetricsConfig metricsConfig) {
        this.evaluatorMap = new EnumMap<>(GateType.class);
        this.profileResolver = profileResolver;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (GateEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getGateType(), evaluator);
            log.info("Registered gate: {} -> {}", evaluator.getGateType(), evaluator.getClass().getSimpleName());
        }
        for (GateType type : GateType.values()) {
            if (!evaluatorMap.containsKey(type)) {
                throw new IllegalStateException("No evaluator registered for gate " + type);
            }
        }
    }

    /**
     * Evaluate a request that opens a new chain; the profile is resolved from policy.
     */
    public GateVerdict evaluate(ApprovalRequest request, PolicySnapshot policy,
                                EnvironmentSnapshot environment, long now) {
        return evaluate(request, policy, environment, now, null);
    }

    /**
     * Evaluate a request. A non-null {@code chainProfile} is the snapshot taken when the
     * chain was opened and is used instead of the current policy's profile.
     */
    public GateVerdict evaluate(ApprovalRequest request, PolicySnapshot policy,
                                EnvironmentSnapshot environment, long now, ApprovalProfile chainProfile) {
        GateContext context = GateContext.builder()
                .policy(policy)
                .environment(environment)
                .now(now)
                .build();

        GateOutcome rbac = run(GateType.RBAC, request, context);
        if (rbac.failed()) {
            return GateVerdict.rejected(null, List.of(rbac));
        }

        ApprovalProfile profile = chainProfile;
        if (profile == null) {
            Optional<ApprovalProfile> resolved =
                    profileResolver.resolve(request.getAction(), request.getTtlOverrideSeconds(), policy);
            if (resolved.isEmpty()) {
                GateOutcome unknown = new GateOutcome(GateType.RBAC, GateOutcome.Status.FAIL,
                        List.of(RejectionReason.UNKNOWN_ACTION), "No approval profile for " + request.getAction());
                metricsConfig.recordGateFailure(RejectionReason.UNKNOWN_ACTION.getCode());
                return GateVerdict.rejected(null, List.of(unknown));
            }
            profile = resolved.get();
        }

        GateContext profiled = context.toBuilder().profile(profile).build();
        List<GateOutcome> failures = new ArrayList<>();
        for (GateType type : JOINT_GATES) {
            GateOutcome outcome = run(type, request, profiled);
            if (outcome.failed()) {
                failures.add(outcome);
            }
        }
        if (!failures.isEmpty()) {
            return GateVerdict.rejected(profile, failures);
        }

        GateOutcome bypass = run(GateType.EMERGENCY_BYPASS, request, profiled);
        if (bypass.bypassed()) {
            return GateVerdict.bypass(profile, bypass.detail());
        }
        return GateVerdict.passed(profile);
    }

    private GateOutcome run(GateType type, ApprovalRequest request, GateContext context) {
        Span gateSpan = tracer.nextSpan()
                .name("gate.evaluate." + type)
                .tag("approval.key", String.valueOf(request.getApprovalKey()))
                .tag("approval.action", String.valueOf(request.getAction()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(gateSpan)) {
            GateOutcome outcome = evaluatorMap.get(type).evaluate(request, context);
            gateSpan.tag("gate.status", outcome.status().name());

            if (outcome.failed()) {
                outcome.reasons().forEach(r -> metricsConfig.recordGateFailure(r.getCode()));
                log.warn("Gate {} failed for {} ({}): {}",
                        type, request.getApprovalKey(), request.getAction(), outcome.detail());
            }
            return outcome;
        } catch (RuntimeException e) {
            gateSpan.error(e);
            // A gate that cannot decide must not let the request through.
            throw new GatewayException("Gate " + type + " failed for " + request.getApprovalKey(), e);
        } finally {
            gateSpan.end();
        }
    }
}
