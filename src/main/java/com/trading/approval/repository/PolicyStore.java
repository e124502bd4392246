package com.trading.approval.repository;

import com.trading.approval.model.PolicySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current policy snapshot. Readers always see one complete snapshot;
 * ingestion swaps the whole snapshot in a single write.
 */
@Repository
public class PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private final AtomicReference<PolicySnapshot> current = new AtomicReference<>(PolicySnapshot.EMPTY);

    public PolicySnapshot current() {
        return current.get();
    }

    public void replace(PolicySnapshot snapshot) {
        PolicySnapshot previous = current.getAndSet(snapshot);
        log.info("Policy snapshot replaced: roles={}, profiles={} (previous roles={}, profiles={})",
                snapshot.roles().size(), snapshot.approvalProfiles().size(),
                previous.roles().size(), previous.approvalProfiles().size());
    }
}
