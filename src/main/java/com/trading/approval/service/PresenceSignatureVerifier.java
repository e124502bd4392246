package com.trading.approval.service;

import com.trading.approval.model.Requester;
import org.springframework.stereotype.Component;

/**
 * Accepts any non-blank signature. Register a {@code @Primary} {@link SignatureVerifier} bean to replace it.
 */
@Component
public class PresenceSignatureVerifier implements SignatureVerifier {

    @Override
    public boolean verify(Requester requester) {
        return requester != null
                && requester.signature() != null
                && !requester.signature().isBlank();
    }
}
