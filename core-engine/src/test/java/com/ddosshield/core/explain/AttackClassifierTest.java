package com.ddosshield.core.explain;

import com.ddosshield.core.model.AttackType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.ddosshield.core.TestFixtures.vector;
import static org.assertj.core.api.Assertions.assertThat;

class AttackClassifierTest {

    @Test
    @DisplayName("Half-open TCP handshakes are a SYN flood")
    void shouldDetectSynFlood() {
        assertThat(AttackClassifier.classify(vector(Map.of(
                "protocol_tcp", 1.0, "flag_syn", 0.95, "flag_ack", 0.05))))
                .isEqualTo(AttackType.SYN_FLOOD);
    }

    @Test
    @DisplayName("Completed handshakes at a high flow rate are a connection flood")
    void shouldDetectConnectionFlood() {
        assertThat(AttackClassifier.classify(vector(Map.of(
                "protocol_tcp", 1.0, "flag_syn", 0.9, "flag_ack", 0.9, "flow_rate", 400.0))))
                .isEqualTo(AttackType.CONNECTION_FLOOD);
    }

    @Test
    @DisplayName("Protocol dominated traffic maps to UDP and ICMP floods")
    void shouldDetectProtocolFloods() {
        assertThat(AttackClassifier.classify(vector(Map.of("protocol_udp", 0.9))))
                .isEqualTo(AttackType.UDP_FLOOD);
        assertThat(AttackClassifier.classify(vector(Map.of("protocol_icmp", 0.8))))
                .isEqualTo(AttackType.ICMP_FLOOD);
    }

    @Test
    @DisplayName("Mixed traffic with a huge byte rate is volumetric, anything else unknown")
    void shouldFallBackToVolumetricOrUnknown() {
        assertThat(AttackClassifier.classify(vector(Map.of("protocol_tcp", 0.4, "byte_rate", 2e7))))
                .isEqualTo(AttackType.VOLUMETRIC);
        assertThat(AttackClassifier.classify(vector(Map.of("protocol_tcp", 0.4, "byte_rate", 1e3))))
                .isEqualTo(AttackType.UNKNOWN);
    }
}
