package com.ddosshield.flink;

import com.ddosshield.core.error.MalformedEventException;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.metrics.ShieldMetrics;
import com.ddosshield.core.model.FlowEvent;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link DeserializationSchema} that turns raw Kafka bytes into a
 * validated {@link FlowEvent}.
 *
 * <p>
 * Unparseable JSON and events that fail {@link FlowEvent#validate()} are
 * counted as {@code ingest.malformed} and dropped (the method returns
 * {@code null}), so a single bad record never fails the job.
 * </p>
 */
public class FlowEventDeserializationSchema implements DeserializationSchema<FlowEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(FlowEventDeserializationSchema.class);

    private transient ObjectMapper mapper;
    private transient ShieldMetrics metrics;
    private transient long malformed;

    @Override
    public void open(InitializationContext context) {
        metrics = new FlinkShieldMetrics(context.getMetricGroup());
    }

    @Override
    public FlowEvent deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return malformed("empty message");
        }
        FlowEvent event;
        try {
            event = objectMapper().readValue(message, FlowEvent.class);
        } catch (Exception e) {
            return malformed(e.getMessage());
        }
        try {
            event.validate();
        } catch (MalformedEventException e) {
            return malformed(e.getMessage());
        }
        metrics().increment(MetricNames.INGEST_ACCEPTED);
        return event;
    }

    @Override
    public boolean isEndOfStream(FlowEvent nextElement) {
        return false;
    }

    @Override
    public TypeInformation<FlowEvent> getProducedType() {
        return TypeInformation.of(FlowEvent.class);
    }

    /** Number of records dropped by this instance. */
    long malformedCount() {
        return malformed;
    }

    private FlowEvent malformed(String reason) {
        metrics().increment(MetricNames.INGEST_MALFORMED);
        malformed++;
        if (malformed == 1 || malformed % 1000 == 0) {
            LOG.warn("Dropping malformed flow record ({} so far): {}", malformed, reason);
        } else {
            LOG.debug("Dropping malformed flow record: {}", reason);
        }
        return null;
    }

    private ShieldMetrics metrics() {
        if (metrics == null) {
            metrics = ShieldMetrics.NO_OP;
        }
        return metrics;
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
