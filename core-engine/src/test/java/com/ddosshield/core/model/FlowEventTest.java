package com.ddosshield.core.model;

import com.ddosshield.core.error.MalformedEventException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FlowEvent}.
 */
class FlowEventTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static FlowEvent.Builder valid() {
        return FlowEvent.builder()
                .sourceAddress("198.51.100.4")
                .sourcePort(5353)
                .protocol(Protocol.UDP)
                .timestamp(T0)
                .bytes(100)
                .packets(1);
    }

    @Test
    @DisplayName("Should report every problem of a malformed event")
    void shouldCollectProblems() {
        FlowEvent event = FlowEvent.builder().bytes(-1).destinationPort(70_000).build();

        assertThatThrownBy(event::validate)
                .isInstanceOfSatisfying(MalformedEventException.class, e -> assertThat(e.getProblems())
                        .hasSize(4)
                        .anyMatch(p -> p.contains("sourceAddress"))
                        .anyMatch(p -> p.contains("timestamp"))
                        .anyMatch(p -> p.contains("bytes"))
                        .anyMatch(p -> p.contains("destinationPort")));
        assertThat(event.isValid()).isFalse();
    }

    @Test
    @DisplayName("Identity granularity decides how much of the tuple is kept")
    void shouldDeriveIdentityPerGranularity() {
        FlowEvent event = valid().build();

        assertThat(event.identity(IdentityGranularity.ADDRESS).key()).isEqualTo("198.51.100.4");
        assertThat(event.identity(IdentityGranularity.ADDRESS_PROTOCOL).key()).isEqualTo("198.51.100.4/UDP");
        assertThat(event.identity(IdentityGranularity.ADDRESS_PORT_PROTOCOL).key())
                .isEqualTo("198.51.100.4:5353/UDP");
    }

    @Test
    @DisplayName("Port-scoped identity of an event without protocol is malformed")
    void shouldRejectPortIdentityWithoutProtocol() {
        FlowEvent event = valid().protocol(null).build();

        assertThat(event.isValid()).isTrue();
        assertThatThrownBy(() -> event.identity(IdentityGranularity.ADDRESS_PORT_PROTOCOL))
                .isInstanceOf(MalformedEventException.class);
    }
}
