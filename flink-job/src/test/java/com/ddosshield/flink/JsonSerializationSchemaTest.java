package com.ddosshield.flink;

import com.ddosshield.core.model.ActionKind;
import com.ddosshield.core.model.MitigationAction;
import com.ddosshield.core.model.SourceIdentity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonSerializationSchema} and
 * {@link IdentityKeySerializationSchema}.
 */
class JsonSerializationSchemaTest {

    private static final Instant ISSUED = Instant.parse("2024-01-01T00:00:10Z");

    private final MitigationAction block = MitigationAction.builder()
            .actionId("a-1")
            .sourceIdentity(SourceIdentity.parse("203.0.113.7/UDP"))
            .action(ActionKind.BLOCK)
            .reason("score 0.97 confirmed 3 times")
            .issuedAt(ISSUED)
            .expiresAt(ISSUED.plusSeconds(60))
            .build();

    @Test
    @DisplayName("Actions are written as JSON with ISO-8601 timestamps and the identity as a string")
    void shouldWriteJson() throws Exception {
        byte[] bytes = new JsonSerializationSchema<MitigationAction>().serialize(block);

        JsonNode json = new ObjectMapper().readTree(bytes);
        assertThat(json.get("actionId").asText()).isEqualTo("a-1");
        assertThat(json.get("sourceIdentity").asText()).isEqualTo("203.0.113.7/UDP");
        assertThat(json.get("action").asText()).isEqualTo("BLOCK");
        assertThat(json.get("issuedAt").asText()).isEqualTo("2024-01-01T00:00:10Z");
        assertThat(json.get("expiresAt").asText()).isEqualTo("2024-01-01T00:01:10Z");
        assertThat(json.has("verdict")).isFalse();
    }

    @Test
    @DisplayName("Record keys are the canonical source identity")
    void shouldKeyBySource() {
        byte[] key = new IdentityKeySerializationSchema<MitigationAction>().serialize(block);

        assertThat(new String(key, StandardCharsets.UTF_8)).isEqualTo("203.0.113.7/UDP");
    }
}
