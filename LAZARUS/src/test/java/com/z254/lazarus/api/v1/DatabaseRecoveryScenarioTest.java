package com.z254.lazarus.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

/**
 * A silent database heartbeat, remediated by the shipped {@code db_recovery} playbook.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "lazarus.playbooks.location=classpath*:playbooks/*.yml")
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class DatabaseRecoveryScenarioTest {

    private static final String DB = "db";
    private static final String DETECTOR = "hb-db";

    @Autowired
    private WebTestClient webTestClient;

    @AfterEach
    void tearDown() {
        webTestClient.delete().uri("/api/v1/detectors/{id}", DETECTOR).exchange();
    }

    @Test
    @DisplayName("missed heartbeat on db is resolved by db_recovery within a minute")
    void missedHeartbeatIsResolvedByDatabaseRecovery() {
        webTestClient.get().uri("/api/v1/playbooks/db_recovery")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.priority").isEqualTo(10)
                .jsonPath("$.steps.length()").isEqualTo(3);

        webTestClient.post().uri("/api/v1/chaos/resources/{key}/inject", DB)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("attributes", Map.of("storage_lock", "held", "connection_pool", "exhausted")))
                .exchange()
                .expectStatus().isOk();

        webTestClient.post().uri("/api/v1/detectors/heartbeat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("id", DETECTOR, "resourceKey", DB, "timeoutMs", 200))
                .exchange()
                .expectStatus().isCreated();

        JsonNode summary = await().atMost(Duration.ofSeconds(30)).until(this::firstIncident,
                node -> node != null && "RESOLVED".equals(node.get("status").asText()));
        JsonNode incident = webTestClient.get().uri("/api/v1/incidents/{id}", summary.get("id").asText())
                .exchange()
                .expectStatus().isOk()
                .expectBody(JsonNode.class)
                .returnResult()
                .getResponseBody();

        assertThat(incident.get("playbookId").asText()).isEqualTo("db_recovery");
        assertThat(incident.get("kind").asText()).isEqualTo("heartbeat_timeout");
        assertThat(incident.get("detectorId").asText()).isEqualTo(DETECTOR);

        JsonNode execution = incident.get("executions").get(0);
        assertThat(execution.get("success").asBoolean()).isTrue();
        assertThat(execution.get("steps")).hasSize(3);
        execution.get("steps").forEach(step ->
                assertThat(step.get("status").asText()).isEqualTo("SUCCEEDED"));

        Instant detectedAt = Instant.parse(incident.get("detectedAt").asText());
        Instant resolvedAt = Instant.parse(incident.get("resolvedAt").asText());
        double mttr = incident.get("mttrSeconds").asDouble();
        assertThat(mttr).isLessThan(60.0);
        assertThat(mttr).isCloseTo(Duration.between(detectedAt, resolvedAt).toMillis() / 1000.0, within(0.001));
        assertThat(execution.get("mttrSeconds").asDouble()).isEqualTo(mttr);

        webTestClient.get().uri("/api/v1/chaos/resources/{key}", DB)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state.attributes.storage_lock").isEqualTo("free")
                .jsonPath("$.state.attributes.connection_pool").isEqualTo("healthy")
                .jsonPath("$.state.attributes.dependencies").isEqualTo("synced");
    }

    private JsonNode firstIncident() {
        JsonNode history = webTestClient.get().uri("/api/v1/incidents/history/{key}", DB)
                .exchange()
                .expectStatus().isOk()
                .expectBody(JsonNode.class)
                .returnResult()
                .getResponseBody();
        return history == null || history.isEmpty() ? null : history.get(0);
    }
}
