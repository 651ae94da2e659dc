package com.z254.lazarus.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

/**
 * Full application against the sandbox control plane, driven only through the REST API.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class LazarusApiIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void signalIsRemediatedToResolved() {
        String resource = resource();
        webTestClient.post().uri("/api/v1/chaos/resources/{key}/inject", resource)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("attributes", Map.of("storage_lock", "held", "connection_pool", "exhausted")))
                .exchange()
                .expectStatus().isOk();

        JsonNode decision = submit(resource, "storage_locked")
                .expectStatus().isAccepted()
                .expectBody(JsonNode.class)
                .returnResult()
                .getResponseBody();
        assertThat(decision.get("outcome").asText()).isEqualTo("OPENED");
        assertThat(decision.get("playbookId").asText()).isEqualTo("storage_recovery");
        String incidentId = decision.get("incidentId").asText();

        awaitStatus(incidentId, "RESOLVED");

        JsonNode incident = webTestClient.get().uri("/api/v1/incidents/{id}", incidentId)
                .exchange()
                .expectStatus().isOk()
                .expectBody(JsonNode.class)
                .returnResult()
                .getResponseBody();
        assertThat(incident.get("attemptCount").asInt()).isEqualTo(1);
        assertThat(incident.at("/executions/0/success").asBoolean()).isTrue();
        Duration outage = Duration.between(Instant.parse(incident.get("detectedAt").asText()),
                Instant.parse(incident.get("resolvedAt").asText()));
        assertThat(incident.get("mttrSeconds").asDouble()).isCloseTo(outage.toMillis() / 1000.0, within(0.001));

        webTestClient.get().uri("/api/v1/chaos/resources/{key}", resource)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state.attributes.storage_lock").isEqualTo("free")
                .jsonPath("$.state.attributes.connection_pool").isEqualTo("healthy");

        webTestClient.get().uri("/api/v1/audit/verify")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.valid").isEqualTo(true);
    }

    @Test
    void approvalFlowRunsFollowUp() {
        String resource = resource();
        webTestClient.post().uri("/api/v1/chaos/resources/{key}/inject", resource)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("attributes", Map.of("status", "DOWN")))
                .exchange()
                .expectStatus().isOk();

        submit(resource, "service_unreachable").expectStatus().isAccepted();
        String incidentId = lastIncident(resource);
        awaitStatus(incidentId, "ESCALATED");

        JsonNode approval = webTestClient.post().uri("/api/v1/incidents/{id}/approve", incidentId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("approver", "alice"))
                .exchange()
                .expectStatus().isOk()
                .expectBody(JsonNode.class)
                .returnResult()
                .getResponseBody();

        assertThat(approval.at("/ticket/reason").asText()).isEqualTo("APPROVAL_REQUIRED");
        assertThat(approval.at("/ticket/status").asText()).isEqualTo("RESOLVED");
        String followUpId = approval.at("/followUp/id").asText();
        awaitStatus(followUpId, "RESOLVED");

        webTestClient.post().uri("/api/v1/incidents/{id}/approve", incidentId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("approver", "alice"))
                .exchange()
                .expectStatus().isEqualTo(409);
    }

    @Test
    void unmatchedSignalIsUnhandled() {
        submit(resource(), "cosmic_ray")
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.outcome").isEqualTo("UNHANDLED")
                .jsonPath("$.incidentId").doesNotExist();

        webTestClient.get().uri("/api/v1/remediation-metrics")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.coverageGaps.cosmic_ray").value(count ->
                        assertThat(((Number) count).longValue()).isPositive());
    }

    @Test
    void invalidSignalIsRejected() {
        webTestClient.post().uri("/api/v1/signals")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("resourceKey", "it-x"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.violations[0]").value(v -> assertThat(v.toString()).startsWith("kind"));
    }

    @Test
    void unknownIncidentIsNotFound() {
        webTestClient.get().uri("/api/v1/incidents/{id}", "missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404);
    }

    @Test
    void abortOfResolvedIncidentConflicts() {
        String resource = resource();
        submit(resource, "storage_locked").expectStatus().isAccepted();
        String incidentId = lastIncident(resource);
        awaitStatus(incidentId, "RESOLVED");

        webTestClient.post().uri("/api/v1/incidents/{id}/abort", incidentId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("actor", "carol"))
                .exchange()
                .expectStatus().isEqualTo(409);
    }

    @Test
    void playbooksArePublishedAndValidated() {
        String id = "it_pb_" + UUID.randomUUID().toString().substring(0, 8);
        Map<String, Object> document = Map.of(
                "id", id,
                "name", "Cache flush",
                "version", 1,
                "trigger_pattern", Map.of("kind", "cache_stale", "resource", "it-.*"),
                "steps", List.of(Map.of("action_id", "flush_circuit_breakers", "timeout_ms", 1000,
                        "has_verify", true, "has_rollback", true)));

        webTestClient.post().uri("/api/v1/playbooks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(document)
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo(id);

        webTestClient.post().uri("/api/v1/playbooks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(document)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.violations").isNotEmpty();

        webTestClient.post().uri("/api/v1/playbooks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "id", id + "_bad",
                        "name", "Broken",
                        "version", 1,
                        "trigger_pattern", "cache_stale",
                        "steps", List.of(Map.of("action_id", "restart_service", "timeout_ms", 1000,
                                "has_rollback", true))))
                .exchange()
                .expectStatus().isBadRequest();

        webTestClient.get().uri("/api/v1/playbooks/{id}/versions", id)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1);
    }

    @Test
    void dryRunLeavesResourceUntouched() {
        String resource = resource();
        webTestClient.post().uri("/api/v1/chaos/resources/{key}/inject", resource)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("attributes", Map.of("storage_lock", "held")))
                .exchange()
                .expectStatus().isOk();

        webTestClient.post().uri("/api/v1/playbooks/storage_recovery/dry-run")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("resourceKey", resource))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.dryRun").isEqualTo(true);

        webTestClient.get().uri("/api/v1/chaos/resources/{key}", resource)
                .exchange()
                .expectBody()
                .jsonPath("$.state.attributes.storage_lock").isEqualTo("held");
        webTestClient.get().uri("/api/v1/incidents/history/{key}", resource)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(0);
    }

    // ========== Private Methods ==========

    private static String resource() {
        return "it-" + UUID.randomUUID();
    }

    private WebTestClient.ResponseSpec submit(String resourceKey, String kind) {
        return webTestClient.post().uri("/api/v1/signals")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("resourceKey", resourceKey, "kind", kind, "severity", "HIGH"))
                .exchange();
    }

    private String lastIncident(String resourceKey) {
        JsonNode history = webTestClient.get().uri("/api/v1/incidents/history/{key}", resourceKey)
                .exchange()
                .expectStatus().isOk()
                .expectBody(JsonNode.class)
                .returnResult()
                .getResponseBody();
        assertThat(history).isNotNull();
        assertThat(history.size()).isPositive();
        return history.get(history.size() - 1).get("id").asText();
    }

    private void awaitStatus(String incidentId, String status) {
        await().atMost(Duration.ofSeconds(15)).untilAsserted(() ->
                webTestClient.get().uri("/api/v1/incidents/{id}", incidentId)
                        .exchange()
                        .expectStatus().isOk()
                        .expectBody()
                        .jsonPath("$.status").isEqualTo(status));
    }
}
