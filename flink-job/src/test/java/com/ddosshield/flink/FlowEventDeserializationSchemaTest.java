package com.ddosshield.flink;

import com.ddosshield.core.model.FlowEvent;
import com.ddosshield.core.model.Protocol;
import com.ddosshield.core.model.TcpFlag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FlowEventDeserializationSchema}.
 */
class FlowEventDeserializationSchemaTest {

    private final FlowEventDeserializationSchema schema = new FlowEventDeserializationSchema();

    @Test
    @DisplayName("Valid JSON becomes a flow event and unknown fields are ignored")
    void shouldDeserializeFlow() {
        FlowEvent event = schema.deserialize(bytes("{\"sourceAddress\":\"203.0.113.7\",\"sourcePort\":51515,"
                + "\"destinationPort\":80,\"protocol\":\"tcp\",\"timestamp\":\"2024-05-01T10:00:00Z\","
                + "\"bytes\":1200,\"packets\":20,\"flags\":[\"SYN\"],\"durationMillis\":40,"
                + "\"exporter\":\"edge-1\"}"));

        assertThat(event).isNotNull();
        assertThat(event.getSourceAddress()).isEqualTo("203.0.113.7");
        assertThat(event.getProtocol()).isEqualTo(Protocol.TCP);
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(event.getPackets()).isEqualTo(20);
        assertThat(event.hasFlag(TcpFlag.SYN)).isTrue();
        assertThat(schema.malformedCount()).isZero();
    }

    @Test
    @DisplayName("Unparseable, empty and invalid records are dropped and counted")
    void shouldDropMalformed() {
        assertThat(schema.deserialize(bytes("not json"))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
        assertThat(schema.deserialize(bytes("{\"sourceAddress\":\"example.com\","
                + "\"timestamp\":\"2024-05-01T10:00:00Z\"}"))).isNull();
        assertThat(schema.deserialize(bytes("{\"sourceAddress\":\"203.0.113.7\"}"))).isNull();

        assertThat(schema.malformedCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("The stream never ends")
    void shouldBeUnbounded() {
        assertThat(schema.isEndOfStream(null)).isFalse();
        assertThat(schema.getProducedType().getTypeClass()).isEqualTo(FlowEvent.class);
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
