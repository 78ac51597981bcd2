package com.ddosshield.flink;

import com.ddosshield.core.config.ShieldConfig;
import com.ddosshield.core.error.MalformedEventException;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.metrics.ShieldMetrics;
import com.ddosshield.core.mitigation.TransitionOutcome;
import com.ddosshield.core.model.AlertEvent;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.FlowEvent;
import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.model.MitigationAction;
import com.ddosshield.core.model.SourceIdentity;
import com.ddosshield.core.pipeline.ShieldEngine;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Runs the mitigation engine per source identity inside Flink.
 *
 * <p>
 * Each parallel instance owns one {@link ShieldEngine} built in
 * {@link #open(Configuration)}. Flink routes all events of one identity to
 * the same instance and calls it from a single thread, so the per-source
 * ordering the state machine relies on holds. Mitigation actions go to the
 * main output, alerts to the {@link #ALERTS} side output.
 * </p>
 *
 * <h3>Timers</h3>
 * <ul>
 * <li>Every event registers a processing-time timer at the end of its
 * aligned window; when it fires the key's due windows are closed, scored and
 * decided.</li>
 * <li>Block expiry and end of probation are armed through
 * {@link KeyedTimerService} on the same key.</li>
 * <li>Timer callbacks also sweep idle sources, at most once per configured
 * flush interval.</li>
 * </ul>
 *
 * <h3>State</h3>
 * <p>
 * Per-source state is operator-local and is not part of Flink checkpoints.
 * After a restart every source starts over as OBSERVING.
 * </p>
 *
 * @since 1.0.0
 */
public class MitigationProcessFunction
        extends KeyedProcessFunction<String, FlowEvent, MitigationAction> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MitigationProcessFunction.class);

    /** Side output carrying alerts. */
    public static final OutputTag<AlertEvent> ALERTS = new OutputTag<>("ddos-alerts") {
        private static final long serialVersionUID = 1L;
    };

    private final ShieldConfig config;

    private transient ShieldEngine engine;
    private transient KeyedTimerService timers;
    private transient ShieldMetrics metrics;
    private transient long lastSweepMillis;

    /**
     * @param config validated engine configuration
     */
    public MitigationProcessFunction(ShieldConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        metrics = new FlinkShieldMetrics(getRuntimeContext().getMetricGroup());
        timers = new KeyedTimerService();
        engine = ShieldEngine.create(config, Clock.systemUTC(), metrics, timers,
                (component, evicted, capacity) -> LOG.debug("{} evicted {} at capacity {}",
                        component, evicted, capacity));
        LOG.info("MitigationProcessFunction opened (subtask {})",
                getRuntimeContext().getIndexOfThisSubtask());
    }

    @Override
    public void close() {
        if (engine != null) {
            engine.close();
        }
        LOG.info("MitigationProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(FlowEvent event,
            KeyedProcessFunction<String, FlowEvent, MitigationAction>.Context ctx,
            Collector<MitigationAction> out) {
        SourceIdentity identity = SourceIdentity.parse(ctx.getCurrentKey());
        Instant now = Instant.ofEpochMilli(ctx.timerService().currentProcessingTime());
        timers.bind(ctx.timerService(), identity);
        try {
            try {
                engine.getAggregator().ingest(event);
            } catch (MalformedEventException e) {
                metrics.increment(MetricNames.INGEST_MALFORMED);
                LOG.debug("Dropping malformed flow event for {}: {}", identity, e.getMessage());
                return;
            }
            long windowEnd = engine.getAggregator().windowEndFor(event.getTimestamp()).toEpochMilli();
            ctx.timerService().registerProcessingTimeTimer(windowEnd);
            // a later event may have closed the previous window already
            scoreDue(identity, now, ctx, out);
        } finally {
            timers.unbind();
        }
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, FlowEvent, MitigationAction>.OnTimerContext ctx,
            Collector<MitigationAction> out) {
        SourceIdentity identity = SourceIdentity.parse(ctx.getCurrentKey());
        Instant now = Instant.ofEpochMilli(timestamp);
        timers.bind(ctx.timerService(), identity);
        try {
            OptionalLong generation = timers.fire(identity, timestamp);
            if (generation.isPresent()) {
                emit(engine.getStateMachine().onTimer(identity, generation.getAsLong(), now), ctx, out);
            }
            scoreDue(identity, now, ctx, out);
        } finally {
            timers.unbind();
        }
        sweepIdle(timestamp);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void scoreDue(SourceIdentity identity, Instant now,
            KeyedProcessFunction<String, FlowEvent, MitigationAction>.Context ctx,
            Collector<MitigationAction> out) {
        List<FeatureVector> vectors = engine.getAggregator().flushDue(identity, now);
        for (FeatureVector vector : vectors) {
            FusedVerdict verdict = engine.getScorer().score(vector);
            emit(engine.decide(verdict), ctx, out);
        }
    }

    private void emit(List<TransitionOutcome> outcomes,
            KeyedProcessFunction<String, FlowEvent, MitigationAction>.Context ctx,
            Collector<MitigationAction> out) {
        for (TransitionOutcome outcome : outcomes) {
            outcome.getAction().ifPresent(out::collect);
            outcome.getAlert().ifPresent(alert -> ctx.output(ALERTS, alert));
        }
    }

    private void sweepIdle(long nowMillis) {
        if (nowMillis - lastSweepMillis < config.getPipeline().getFlushIntervalMillis()) {
            return;
        }
        lastSweepMillis = nowMillis;
        for (SourceIdentity evicted : engine.getStateMachine().evictIdle(Instant.ofEpochMilli(nowMillis))) {
            engine.getScorer().forget(evicted);
        }
    }
}
