package com.ddosshield.flink;

import com.ddosshield.core.config.ShieldConfig;
import com.ddosshield.core.config.ShieldConfigLoader;
import com.ddosshield.core.model.AlertEvent;
import com.ddosshield.core.model.FlowEvent;
import com.ddosshield.core.model.MitigationAction;
import com.ddosshield.core.model.ShieldEvent;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.base.DeliveryGuarantee;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the Flink deployment.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (flows topic)
 *     -&gt; JSON -&gt; FlowEvent (malformed records dropped and counted)
 *     -&gt; key by source identity
 *     -&gt; MitigationProcessFunction
 *          main output  -&gt; MitigationAction -&gt; Kafka (actions topic)
 *          side output  -&gt; AlertEvent       -&gt; Kafka (alerts topic)
 * </pre>
 *
 * <p>
 * Job settings come from environment variables via {@link JobConfig}; engine
 * settings from the YAML file it names, or the classpath {@code shield.yml}.
 * Checkpointing covers Kafka offsets only; the engine's per-source state is
 * rebuilt from scratch after a restart.
 * </p>
 *
 * @since 1.0.0
 */
public final class ShieldJob {

    private static final Logger LOG = LoggerFactory.getLogger(ShieldJob.class);

    private ShieldJob() {
        // entry-point class
    }

    public static void main(String[] args) throws Exception {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting DDoS Shield with {}", config);

        ShieldConfig shieldConfig = loadShieldConfig(config);
        LOG.info("Loaded {}", shieldConfig);

        HealthServer healthServer = new HealthServer();
        healthServer.start(config.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        configureCheckpointing(env, config);

        buildPipeline(env, config, shieldConfig);

        healthServer.markReady();
        env.execute("DDoS Shield - Classification and Mitigation");
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    static void buildPipeline(StreamExecutionEnvironment env, JobConfig config, ShieldConfig shieldConfig) {
        KafkaSource<FlowEvent> source = KafkaSource.<FlowEvent>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getFlowTopic())
                .setGroupId(config.getKafkaGroupId())
                .setProperties(config.kafkaConsumerProperties())
                .setStartingOffsets(OffsetsInitializer.latest())
                .setValueOnlyDeserializer(new FlowEventDeserializationSchema())
                .build();

        DataStream<FlowEvent> flows = env.fromSource(source, WatermarkStrategy.noWatermarks(), "kafka-flows-source");

        SingleOutputStreamOperator<MitigationAction> actions = flows
                .filter(Objects::nonNull)
                .name("drop-malformed")
                .keyBy(new IdentityKeySelector(shieldConfig.getAggregation().granularity()))
                .process(new MitigationProcessFunction(shieldConfig))
                .name("ddos-mitigation");

        DataStream<AlertEvent> alerts = actions.getSideOutput(MitigationProcessFunction.ALERTS);

        actions.sinkTo(kafkaSink(config, config.getActionTopic())).name("kafka-actions-sink");
        alerts.sinkTo(kafkaSink(config, config.getAlertTopic())).name("kafka-alerts-sink");
    }

    static <T extends ShieldEvent> KafkaSink<T> kafkaSink(JobConfig config, String topic) {
        return KafkaSink.<T>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setKafkaProducerConfig(config.kafkaProducerProperties())
                .setDeliveryGuarantee(DeliveryGuarantee.AT_LEAST_ONCE)
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.<T>builder()
                                .setTopic(topic)
                                .setKeySerializationSchema(new IdentityKeySerializationSchema<T>())
                                .setValueSerializationSchema(new JsonSerializationSchema<T>())
                                .build())
                .build();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static ShieldConfig loadShieldConfig(JobConfig config) {
        String path = config.getShieldConfigPath();
        if (path != null && !path.isBlank()) {
            return ShieldConfigLoader.fromFile(path);
        }
        return ShieldConfigLoader.load();
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.AT_LEAST_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
    }
}
