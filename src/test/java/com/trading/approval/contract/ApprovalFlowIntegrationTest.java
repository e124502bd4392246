package com.trading.approval.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.trading.approval.config.TestAerospikeConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives a dual-control approval through the HTTP surface with the full application context.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class ApprovalFlowIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private ResponseEntity<String> send(HttpMethod method, String path, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(path, method, new HttpEntity<>(body, headers), String.class);
    }

    private static String haltRequest(String identity) {
        return """
                {"event":"manual.approval.request","approvalKey":"it-halt-1","action":"halt_entry",
                 "payload":{"scope":"venue"},"reason":"Venue feed stale",
                 "requestedBy":{"identity":"%s","roles":["ops"],"signature":"sig-%s"}}
                """.formatted(identity, identity);
    }

    @Test
    void dualControlHalt_approvedOnceThenReplayed() {
        ResponseEntity<String> policy = send(HttpMethod.PUT, "/api/v1/gateway/policy", """
                {"roles":{"ops":["halt_entry"]},"approvalProfiles":{}}
                """);
        assertThat(policy.getStatusCode()).isEqualTo(HttpStatus.OK);

        DocumentContext first = JsonPath.parse(send(HttpMethod.POST, "/api/v1/events", haltRequest("ops.alice")).getBody());
        assertThat(first.read("$.event", String.class)).isEqualTo("approval.pending");

        DocumentContext second = JsonPath.parse(send(HttpMethod.POST, "/api/v1/events", haltRequest("ops.bob")).getBody());
        assertThat(second.read("$.event", String.class)).isEqualTo("action.approved");
        assertThat(second.read("$.chain.required", String.class)).isEqualTo("dual(2/2)");

        DocumentContext replay = JsonPath.parse(send(HttpMethod.POST, "/api/v1/events", haltRequest("ops.carol")).getBody());
        assertThat(replay.read("$.audit.eventId", String.class))
                .isEqualTo(second.read("$.audit.eventId", String.class));

        ResponseEntity<String> recent = restTemplate.getForEntity(
                "/api/v1/gateway/events/recent?topic=action.approved", String.class);
        List<Object> approvals = JsonPath.parse(recent.getBody()).read("$[?(@.payload.approvalKey == 'it-halt-1')]");
        assertThat(approvals).hasSize(1);

        ResponseEntity<String> history = restTemplate.getForEntity(
                "/api/v1/approvals/history?action=halt_entry&type=approved", String.class);
        assertThat(history.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<String> logged = JsonPath.parse(history.getBody())
                .read("$[?(@.approvalKey == 'it-halt-1')].event");
        assertThat(logged).containsExactly("action.approved");
    }

    @Test
    void malformedEvent_rejectedWithoutSideEffects() {
        ResponseEntity<String> response = send(HttpMethod.POST, "/api/v1/events", "{\"event\":\"emergency.stop\"}");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(JsonPath.parse(response.getBody()).read("$.error", String.class)).contains("active is required");

        ResponseEntity<String> environment = restTemplate.getForEntity("/api/v1/gateway/environment", String.class);
        assertThat(JsonPath.parse(environment.getBody()).read("$.emergencyStop.active", Boolean.class)).isFalse();
    }
}
