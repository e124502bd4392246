package com.trading.approval.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.trading.approval.config.AerospikeConfig;
import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.model.ApprovedDecision;
import com.trading.approval.model.Decision;
import com.trading.approval.model.DecisionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.Map;

import static com.trading.approval.testutil.TestDataFactory.approvedDecision;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DecisionRepositoryTest {

    private final AerospikeClient client = mock(AerospikeClient.class);
    private final ApprovalGatewayConfig config = new ApprovalGatewayConfig();
    private DecisionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new DecisionRepository(client, "test", new WritePolicy(), new Policy(), config);
    }

    @Test
    void save_writesDecisionWithIdempotencyExpiration() {
        ApprovedDecision decision = approvedDecision("halt-1", "halt_entry");

        repository.save(decision);

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        ArgumentCaptor<Key> key = ArgumentCaptor.forClass(Key.class);
        ArgumentCaptor<Bin> bins = ArgumentCaptor.forClass(Bin.class);
        verify(client).put(policy.capture(), key.capture(), bins.capture(), bins.capture(), bins.capture(),
                bins.capture(), bins.capture());

        assertThat(policy.getValue().expiration).isEqualTo(600);
        assertThat(key.getValue().userKey.toString()).isEqualTo("halt-1|APPROVED");
        assertThat(bins.getAllValues()).extracting(b -> b.name)
                .containsExactly("approvalKey", "decisionType", "action", "decidedAt", "json");
        assertThat(bins.getAllValues().get(4).value.toString()).contains("\"event\":\"action.approved\"");
    }

    @Test
    void find_readsJsonBinBackIntoDecision() {
        ApprovedDecision decision = approvedDecision("halt-1", "halt_entry");
        repository.save(decision);
        ArgumentCaptor<Bin> bins = ArgumentCaptor.forClass(Bin.class);
        verify(client).put(any(WritePolicy.class), any(Key.class), bins.capture(), bins.capture(), bins.capture(),
                bins.capture(), bins.capture());

        Map<String, Object> stored = new HashMap<>();
        bins.getAllValues().forEach(b -> stored.put(b.name, b.value.getObject()));
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(new Record(stored, 0, 0));

        Decision found = repository.find("halt-1", DecisionType.APPROVED);

        assertThat(found).isInstanceOf(ApprovedDecision.class);
        ApprovedDecision approved = (ApprovedDecision) found;
        assertThat(approved.approvalKey()).isEqualTo("halt-1");
        assertThat(approved.approvers()).hasSize(2);
        assertThat(approved.chain().required()).isEqualTo("dual(2/2)");
    }

    @Test
    void find_missingRecord_returnsNull() {
        when(client.get(any(Policy.class), eq(new Key("test", AerospikeConfig.SET_DECISIONS, "nope|REJECTED")))).thenReturn(null);

        assertThat(repository.find("nope", DecisionType.REJECTED)).isNull();
    }
}
