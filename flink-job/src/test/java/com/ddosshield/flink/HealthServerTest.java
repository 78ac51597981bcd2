package com.ddosshield.flink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private final HealthServer server = new HealthServer();

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Health is UP as soon as the server runs")
    void shouldReportHealth() throws IOException {
        server.start(0);

        assertThat(server.isRunning()).isTrue();
        assertThat(status("/health")).isEqualTo(200);
        assertThat(body("/health")).isEqualTo("{\"status\":\"UP\"}");
    }

    @Test
    @DisplayName("Readiness answers 503 until the job is marked ready")
    void shouldReportReadiness() throws IOException {
        server.start(0);

        assertThat(status("/readiness")).isEqualTo(503);
        server.markReady();
        assertThat(status("/readiness")).isEqualTo(200);
        assertThat(body("/readiness")).isEqualTo("{\"status\":\"READY\"}");
    }

    @Test
    @DisplayName("Ports outside the valid range are rejected")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> server.start(70_000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Stopping twice is harmless")
    void shouldStopIdempotently() {
        server.start(0);
        server.stop();
        server.stop();

        assertThat(server.isRunning()).isFalse();
    }

    private int status(String path) throws IOException {
        HttpURLConnection connection = open(path);
        try {
            return connection.getResponseCode();
        } finally {
            connection.disconnect();
        }
    }

    private String body(String path) throws IOException {
        HttpURLConnection connection = open(path);
        try (InputStream in = connection.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } finally {
            connection.disconnect();
        }
    }

    private HttpURLConnection open(String path) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) new URL("http://localhost:" + server.getPort() + path)
                .openConnection();
        connection.setConnectTimeout(2_000);
        connection.setReadTimeout(2_000);
        return connection;
    }
}
