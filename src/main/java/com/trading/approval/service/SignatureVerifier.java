package com.trading.approval.service;

import com.trading.approval.model.Requester;

/**
 * Verifies that a request was really produced by the identity it names.
 * Implementations may block; callers bound every call with a timeout.
 */
public interface SignatureVerifier {

    /**
     * @param requester identity, roles and signature of the submitting party
     * @return true when the signature is valid for the requester
     */
    boolean verify(Requester requester);
}
