package com.trading.approval.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.approval.config.AerospikeConfig;
import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.model.ApprovedDecision;
import com.trading.approval.model.Decision;
import com.trading.approval.model.DecisionType;
import com.trading.approval.model.RejectedDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reporting log of emitted decisions. Records expire together with the idempotency window,
 * so this is never a long-term audit trail.
 */
@Repository
public class DecisionRepository {

    private static final Logger log = LoggerFactory.getLogger(DecisionRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ApprovalGatewayConfig config;
    private final ObjectMapper objectMapper;

    public DecisionRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                              @Qualifier("defaultReadPolicy") Policy readPolicy,
                              ApprovalGatewayConfig config) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.config = config;
        this.objectMapper = new ObjectMapper();
    }

    public void save(Decision decision) {
        Key key = keyFor(decision.approvalKey(), decision.type());

        WritePolicy policy = new WritePolicy(writePolicy);
        policy.expiration = (int) Math.min(Integer.MAX_VALUE, config.getIdempotencyTtlSeconds());

        Bin approvalKeyBin = new Bin("approvalKey", decision.approvalKey());
        Bin typeBin = new Bin("decisionType", decision.type().name());
        Bin actionBin = new Bin("action", actionOf(decision));
        Bin decidedAtBin = new Bin("decidedAt", decision.timestamp());
        Bin jsonBin = new Bin("json", serialize(decision));

        client.put(policy, key, approvalKeyBin, typeBin, actionBin, decidedAtBin, jsonBin);
    }

    Decision find(String approvalKey, DecisionType type) {
        Record record = client.get(readPolicy, keyFor(approvalKey, type));
        if (record == null) return null;
        return deserialize(record.getString("json"));
    }

    /**
     * Most recent decisions first, optionally filtered by action and decision type.
     */
    public List<Decision> findRecent(String action, DecisionType type, int limit) {
        List<Record> matches = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DECISIONS,
                (key, record) -> {
                    if (action != null && !action.isEmpty()
                            && !action.equalsIgnoreCase(record.getString("action"))) {
                        return;
                    }
                    if (type != null && !type.name().equals(record.getString("decisionType"))) {
                        return;
                    }
                    synchronized (matches) {
                        matches.add(record);
                    }
                });

        return matches.stream()
                .sorted(Comparator.comparingLong((Record r) -> r.getLong("decidedAt")).reversed())
                .limit(Math.max(0, limit))
                .map(r -> deserialize(r.getString("json")))
                .filter(d -> d != null)
                .toList();
    }

    private Key keyFor(String approvalKey, DecisionType type) {
        return new Key(namespace, AerospikeConfig.SET_DECISIONS, approvalKey + "|" + type.name());
    }

    private static String actionOf(Decision decision) {
        if (decision instanceof ApprovedDecision approved) return approved.action();
        if (decision instanceof RejectedDecision rejected) return rejected.action();
        return "";
    }

    private String serialize(Decision decision) {
        try {
            return objectMapper.writeValueAsString(decision);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Decision for " + decision.approvalKey() + " is not serializable", e);
        }
    }

    private Decision deserialize(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, Decision.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to read decision log record: {}", e.getMessage());
            return null;
        }
    }
}
