package com.ddosshield.flink;

import com.ddosshield.core.config.ShieldConfig;
import com.ddosshield.core.config.ShieldConfigLoader;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the job assembly in {@link ShieldJob}.
 */
class ShieldJobTest {

    @Test
    @DisplayName("The job graph wires the source, the mitigation function and both sinks")
    void shouldBuildJobGraph() {
        StreamExecutionEnvironment env = StreamExecutionEnvironment.createLocalEnvironment(1);
        ShieldConfig shieldConfig = ShieldConfigLoader.fromClasspath(ShieldConfigLoader.DEFAULT_RESOURCE);

        ShieldJob.buildPipeline(env, JobConfig.fromMap(Map.of()), shieldConfig);

        String plan = env.getExecutionPlan();
        assertThat(plan)
                .contains("kafka-flows-source")
                .contains("ddos-mitigation")
                .contains("kafka-actions-sink")
                .contains("kafka-alerts-sink");
    }

    @Test
    @DisplayName("An explicit config path wins over the classpath default")
    void shouldLoadConfigFromPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("shield.yml");
        Files.writeString(file, String.join("\n",
                "aggregation:",
                "  windowSeconds: 20",
                "scoring:",
                "  models:",
                "    - id: rates",
                "      type: threshold",
                "      artifact: classpath:models/threshold.json",
                ""), StandardCharsets.UTF_8);

        ShieldConfig config = ShieldJob.loadShieldConfig(
                new JobConfig.Builder().shieldConfigPath(file.toString()).build());

        assertThat(config.getAggregation().getWindowSeconds()).isEqualTo(20);
        assertThat(config.getScoring().getModels()).hasSize(1);
    }
}
