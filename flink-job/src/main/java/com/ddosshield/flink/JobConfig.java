package com.ddosshield.flink;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable settings of the Flink deployment.
 *
 * <p>
 * Values come from environment variables with defaults, so the job is
 * configured through Kubernetes Deployment env vars or Docker {@code -e}
 * flags. Engine behaviour (windows, models, thresholds) lives in the YAML
 * file named by {@code SHIELD_CONFIG_PATH}, not here.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code KAFKA_BOOTSTRAP_SERVERS} (default {@code localhost:9092})</li>
 * <li>{@code KAFKA_FLOW_TOPIC} (default {@code flows})</li>
 * <li>{@code KAFKA_ACTION_TOPIC} (default {@code mitigation-actions})</li>
 * <li>{@code KAFKA_ALERT_TOPIC} (default {@code ddos-alerts})</li>
 * <li>{@code KAFKA_GROUP_ID} (default {@code ddos-shield})</li>
 * <li>{@code FLINK_PARALLELISM}, {@code FLINK_CHECKPOINT_INTERVAL_MS}</li>
 * <li>{@code SHIELD_CONFIG_PATH}, {@code HEALTH_PORT}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String flowTopic;
    private final String actionTopic;
    private final String alertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Engine / health
    // ---------------------------------------------------------------
    private final String shieldConfigPath;
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.flowTopic = b.flowTopic;
        this.actionTopic = b.actionTopic;
        this.alertTopic = b.alertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.shieldConfigPath = b.shieldConfigPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Build a {@link JobConfig} from an explicit variable map.
     *
     * @param env variable name to value
     * @return validated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .kafkaBootstrapServers(value(env, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .flowTopic(value(env, "KAFKA_FLOW_TOPIC", "flows"))
                    .actionTopic(value(env, "KAFKA_ACTION_TOPIC", "mitigation-actions"))
                    .alertTopic(value(env, "KAFKA_ALERT_TOPIC", "ddos-alerts"))
                    .kafkaGroupId(value(env, "KAFKA_GROUP_ID", "ddos-shield"))
                    .parallelism(Integer.parseInt(value(env, "FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(value(env, "FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .shieldConfigPath(value(env, "SHIELD_CONFIG_PATH", ""))
                    .healthPort(Integer.parseInt(value(env, "HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties
    // ---------------------------------------------------------------

    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "latest");
        return props;
    }

    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getFlowTopic() {
        return flowTopic;
    }

    public String getActionTopic() {
        return actionTopic;
    }

    public String getAlertTopic() {
        return alertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /** Blank means the classpath {@code shield.yml}. */
    public String getShieldConfigPath() {
        return shieldConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}. {@link #build()} rejects blank
     * topics, a non-positive parallelism or checkpoint interval, a port
     * outside [1, 65535], and an action topic equal to the alert topic.
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String flowTopic = "flows";
        private String actionTopic = "mitigation-actions";
        private String alertTopic = "ddos-alerts";
        private String kafkaGroupId = "ddos-shield";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String shieldConfigPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder flowTopic(String v) {
            this.flowTopic = v;
            return this;
        }

        public Builder actionTopic(String v) {
            this.actionTopic = v;
            return this;
        }

        public Builder alertTopic(String v) {
            this.alertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder shieldConfigPath(String v) {
            this.shieldConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public JobConfig build() {
            requireNonBlank(kafkaBootstrapServers, "kafkaBootstrapServers");
            requireNonBlank(flowTopic, "flowTopic");
            requireNonBlank(actionTopic, "actionTopic");
            requireNonBlank(alertTopic, "alertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (actionTopic.equals(alertTopic)) {
                throw new IllegalArgumentException(
                        "actionTopic and alertTopic must differ, both are: " + actionTopic);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (shieldConfigPath == null) {
                shieldConfigPath = "";
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", flowTopic='" + flowTopic + '\'' +
                ", actionTopic='" + actionTopic + '\'' +
                ", alertTopic='" + alertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", shieldConfigPath='" + shieldConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
