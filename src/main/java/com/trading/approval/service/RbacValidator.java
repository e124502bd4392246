package com.trading.approval.service;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.model.PolicySnapshot;
import com.trading.approval.model.RejectionReason;
import com.trading.approval.model.Requester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Signature verification followed by role authorization against the current policy.
 * A verifier that times out, throws or finds the executor saturated denies the request.
 * Timed-out verifications are interrupted so a hung verifier does not hold a worker.
 */
@Service
public class RbacValidator {

    private static final Logger log = LoggerFactory.getLogger(RbacValidator.class);

    private final SignatureVerifier signatureVerifier;
    private final AsyncTaskExecutor executor;
    private final ApprovalGatewayConfig config;

    public RbacValidator(SignatureVerifier signatureVerifier,
                         @Qualifier("signatureVerificationExecutor") AsyncTaskExecutor executor,
                         ApprovalGatewayConfig config) {
        this.signatureVerifier = signatureVerifier;
        this.executor = executor;
        this.config = config;
    }

    public RbacResult validate(Requester requester, String action, PolicySnapshot policy) {
        if (requester == null || requester.identity() == null) {
            return RbacResult.denied(RejectionReason.FORBIDDEN, "Missing requester");
        }

        if (config.getSecurity().isVerifySignature()) {
            RbacResult signature = verifySignature(requester);
            if (!signature.valid()) {
                return signature;
            }
        }

        if (policy == null || !policy.isLoaded()) {
            return RbacResult.denied(RejectionReason.FORBIDDEN, "No policy loaded");
        }
        if (!policy.permits(requester.roles(), action)) {
            return RbacResult.denied(RejectionReason.FORBIDDEN,
                    "Roles " + requester.roles() + " may not approve " + action);
        }
        return RbacResult.ok();
    }

    private RbacResult verifySignature(Requester requester) {
        long timeoutMs = config.getSecurity().getVerifyTimeoutMs();
        Future<Boolean> verification;
        try {
            verification = executor.submit(() -> signatureVerifier.verify(requester));
        } catch (RejectedExecutionException e) {
            log.warn("Signature verification for {} rejected: verifier pool saturated", requester.identity());
            return RbacResult.denied(RejectionReason.FORBIDDEN, "Signature verification unavailable");
        }
        try {
            boolean valid = verification.get(timeoutMs, TimeUnit.MILLISECONDS);
            return valid
                    ? RbacResult.ok()
                    : RbacResult.denied(RejectionReason.SIGNATURE_INVALID,
                            "Signature rejected for " + requester.identity());
        } catch (TimeoutException e) {
            verification.cancel(true);
            log.warn("Signature verification for {} timed out after {}ms", requester.identity(), timeoutMs);
            return RbacResult.denied(RejectionReason.FORBIDDEN, "Signature verification timed out");
        } catch (InterruptedException e) {
            verification.cancel(true);
            Thread.currentThread().interrupt();
            return RbacResult.denied(RejectionReason.FORBIDDEN, "Signature verification interrupted");
        } catch (ExecutionException e) {
            log.warn("Signature verifier failed for {}: {}", requester.identity(), e.getCause().getMessage());
            return RbacResult.denied(RejectionReason.FORBIDDEN, "Signature verification failed");
        }
    }
}
