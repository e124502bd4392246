package com.trading.approval.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.trading.approval.config.TestAerospikeConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published API surface against accidental drift: every endpoint path and
 * the request/response schemas consumers depend on.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        // Inbound envelope
        assertThat(paths).containsKey("/api/v1/events");

        // Approvals
        assertThat(paths).containsKey("/api/v1/approvals/requests");
        assertThat(paths).containsKey("/api/v1/approvals/operator-decisions");
        assertThat(paths).containsKey("/api/v1/approvals/{approvalKey}");
        assertThat(paths).containsKey("/api/v1/approvals/{approvalKey}/revoke");
        assertThat(paths).containsKey("/api/v1/approvals/pending");
        assertThat(paths).containsKey("/api/v1/approvals/history");
        assertThat(paths).containsKey("/api/v1/approvals/stats");

        // Gateway state
        assertThat(paths).containsKey("/api/v1/gateway/policy");
        assertThat(paths).containsKey("/api/v1/gateway/environment");
        assertThat(paths).containsKey("/api/v1/gateway/environment/guard-directive");
        assertThat(paths).containsKey("/api/v1/gateway/environment/bounds-checks");
        assertThat(paths).containsKey("/api/v1/gateway/environment/emergency-stop");
        assertThat(paths).containsKey("/api/v1/gateway/events/recent");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKey("ManualApprovalRequestEvent");
        assertThat(schemas).containsKey("OperatorDecisionFinalEvent");
        assertThat(schemas).containsKey("PolicySnapshotEvent");
        assertThat(schemas).containsKey("PendingDecision");
        assertThat(schemas).containsKey("ApprovalMetricsSnapshot");
        assertThat(schemas).containsKey("ApprovalProfile");
        assertThat(schemas).containsKey("Requester");
    }

    @Test
    void openApiSpec_requestAndPendingSchemas_haveRequiredFields() {
        DocumentContext json = apiDocs();

        Map<String, Object> requestProps = json.read("$.components.schemas.ManualApprovalRequestEvent.properties");
        assertThat(requestProps).containsKeys("approvalKey", "action", "payload", "requestedBy", "reason");

        Map<String, Object> pendingProps = json.read("$.components.schemas.PendingDecision.properties");
        assertThat(pendingProps).containsKeys("approvalKey", "action", "needed", "received", "expiresAt");

        Map<String, Object> profileProps = json.read("$.components.schemas.ApprovalProfile.properties");
        assertThat(profileProps).containsKeys("kind", "quorumCount", "ofCount", "ttlSeconds", "minReasonChars", "allowlist");
    }
}
