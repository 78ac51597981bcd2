package com.ddosshield.core.pipeline;

import com.ddosshield.core.aggregation.CapacityListener;
import com.ddosshield.core.concurrent.ExecutorFactories;
import com.ddosshield.core.config.PipelineSettings;
import com.ddosshield.core.config.ShieldConfig;
import com.ddosshield.core.dispatch.AlertChannel;
import com.ddosshield.core.dispatch.EnforcementGateway;
import com.ddosshield.core.dispatch.EventDispatcher;
import com.ddosshield.core.error.MalformedEventException;
import com.ddosshield.core.metrics.InMemoryShieldMetrics;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.mitigation.ScheduledTimerService;
import com.ddosshield.core.mitigation.TransitionOutcome;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.FlowEvent;
import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.model.IngestResult;
import com.ddosshield.core.model.ShieldEvent;
import com.ddosshield.core.model.SourceIdentity;
import com.ddosshield.core.scoring.ModelFactory;
import com.ddosshield.core.scoring.RegisteredModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process deployment of the engine as concurrent stages connected by
 * bounded queues.
 *
 * <pre>
 * ingest() --offer--&gt; [ingest] --&gt; aggregator
 * ticker --flushDue--&gt; [scoring] --put--&gt; [decision] --put--&gt; [dispatch] --&gt; collaborators
 * timers -----------------------------&gt; state machine --put--&gt; [dispatch]
 * </pre>
 *
 * <p>
 * Ingestion never blocks: a full ingest partition yields
 * {@link IngestResult#BUSY}. The downstream stages block their producer
 * when full. Every stage is partitioned by source identity, so the events of
 * one source are processed in order by one worker per stage.
 * </p>
 *
 * @since 1.0.0
 */
public class MitigationPipeline implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MitigationPipeline.class);

    private final ShieldEngine engine;
    private final Clock clock;
    private final InMemoryShieldMetrics metrics;
    private final ScheduledTimerService timers;
    private final EventDispatcher dispatcher;
    private final VerdictHistory history;
    private final SourceQueryService queryService;
    private final PipelineSettings settings;

    private final PartitionedStage<FlowEvent> ingestStage;
    private final PartitionedStage<FeatureVector> scoringStage;
    private final PartitionedStage<FusedVerdict> decisionStage;
    private final PartitionedStage<ShieldEvent> dispatchStage;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicLong malformed = new AtomicLong();
    private ScheduledExecutorService ticker;

    /**
     * Build a pipeline whose models come from the configured registry, on the
     * system clock.
     */
    public static MitigationPipeline create(ShieldConfig config, EnforcementGateway gateway, AlertChannel channel) {
        return create(config, ModelFactory.createAll(config.getScoring().getModels()), gateway, channel,
                Clock.systemUTC());
    }

    public static MitigationPipeline create(ShieldConfig config, List<RegisteredModel> models,
            EnforcementGateway gateway, AlertChannel channel, Clock clock) {
        return new MitigationPipeline(config, models, gateway, channel, clock, new InMemoryShieldMetrics());
    }

    MitigationPipeline(ShieldConfig config, List<RegisteredModel> models, EnforcementGateway gateway,
            AlertChannel channel, Clock clock, InMemoryShieldMetrics metrics) {
        Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.settings = config.getPipeline();
        this.timers = new ScheduledTimerService(clock);
        CapacityListener capacityListener = (component, evicted, capacity) ->
                LOG.debug("{} evicted {} at capacity {}", component, evicted, capacity);
        this.engine = new ShieldEngine(config, models, clock, metrics, timers, capacityListener);
        this.dispatcher = new EventDispatcher(config.getDispatch(), gateway, channel, metrics, clock);
        this.history = new VerdictHistory(settings.getVerdictHistorySize(),
                config.getMitigation().getMaxTrackedSources());
        this.queryService = new SourceQueryService(engine.getStore(), history, engine.getAggregator(), metrics);

        this.ingestStage = new PartitionedStage<>("ingest", settings.getIngestPartitions(),
                settings.getIngestQueueCapacity(), this::routingKey, this::aggregate, metrics);
        this.scoringStage = new PartitionedStage<>("scoring", settings.getScoringPartitions(),
                settings.getScoringQueueCapacity(), FeatureVector::getIdentity, this::score, metrics);
        this.decisionStage = new PartitionedStage<>("decision", settings.getDecisionPartitions(),
                settings.getDecisionQueueCapacity(), FusedVerdict::getIdentity, this::decide, metrics);
        this.dispatchStage = new PartitionedStage<>("dispatch", settings.getDispatchPartitions(),
                settings.getDispatchQueueCapacity(), ShieldEvent::getSourceIdentity, dispatcher::dispatch, metrics);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start all stages, the timer callback and the periodic window flush
     * and idle sweep.
     *
     * @throws IllegalStateException if already started
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline already started");
        }
        dispatchStage.start();
        decisionStage.start();
        scoringStage.start();
        ingestStage.start();
        timers.start(this::onTimer);

        long interval = settings.getFlushIntervalMillis();
        ticker = ExecutorFactories.newScheduler("shield-ticker");
        ticker.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        LOG.info("Mitigation pipeline started (flush every {} ms)", interval);
    }

    /**
     * Stop the ticker, drain every stage front to back, then release the
     * timers, dispatcher and model pool.
     */
    @Override
    public void close() {
        if (ticker != null) {
            ExecutorFactories.shutdown(ticker, "shield-ticker");
        }
        ingestStage.close();
        scoringStage.close();
        decisionStage.close();
        timers.close();
        dispatchStage.close();
        dispatcher.close();
        engine.close();
        LOG.info("Mitigation pipeline stopped; {}", queryService.stats());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Submit one flow event.
     *
     * @param event raw flow event
     * @return {@link IngestResult#ACCEPTED}, {@link IngestResult#BUSY} if the
     *         ingest queue is full, or {@link IngestResult#MALFORMED}
     */
    public IngestResult ingest(FlowEvent event) {
        if (event == null) {
            return malformed("null event");
        }
        try {
            event.validate();
            event.identity(engine.getAggregator().getGranularity());
        } catch (MalformedEventException e) {
            return malformed(e.getMessage());
        }
        if (!ingestStage.offer(event)) {
            metrics.increment(MetricNames.INGEST_BUSY);
            return IngestResult.BUSY;
        }
        metrics.increment(MetricNames.INGEST_ACCEPTED);
        return IngestResult.ACCEPTED;
    }

    /**
     * Close every due window and hand the vectors to the scoring stage,
     * waiting while it is full. Called periodically by the ticker.
     *
     * @return the vectors handed over
     */
    public List<FeatureVector> flushWindows() {
        List<FeatureVector> vectors = engine.getAggregator().flushDue(clock.instant());
        for (FeatureVector vector : vectors) {
            if (!enqueue(scoringStage, vector)) {
                break;
            }
        }
        return vectors;
    }

    /**
     * Drop sources idle for longer than the idle timeout, together with their
     * verdict history and last known score.
     *
     * @return evicted identities
     */
    public List<SourceIdentity> evictIdle() {
        List<SourceIdentity> evicted = engine.getStateMachine().evictIdle(clock.instant());
        for (SourceIdentity identity : evicted) {
            history.forget(identity);
            engine.getScorer().forget(identity);
        }
        return evicted;
    }

    /**
     * Operator unblock; the resulting action goes through the dispatch stage.
     *
     * @return the transition, or empty if the source was not blocked
     */
    public Optional<TransitionOutcome> manualUnblock(SourceIdentity identity, String operator) {
        Optional<TransitionOutcome> outcome = engine.getStateMachine()
                .manualUnblock(identity, clock.instant(), operator);
        outcome.ifPresent(this::emit);
        return outcome;
    }

    public SourceQueryService query() {
        return queryService;
    }

    public EventDispatcher getDispatcher() {
        return dispatcher;
    }

    public ShieldEngine getEngine() {
        return engine;
    }

    public InMemoryShieldMetrics getMetrics() {
        return metrics;
    }

    // ---------------------------------------------------------------
    // Stage handlers
    // ---------------------------------------------------------------

    private Object routingKey(FlowEvent event) {
        return event.identity(engine.getAggregator().getGranularity());
    }

    private void aggregate(FlowEvent event) {
        engine.getAggregator().ingest(event);
    }

    private void score(FeatureVector vector) {
        FusedVerdict verdict = engine.getScorer().score(vector);
        history.record(verdict);
        enqueue(decisionStage, verdict);
    }

    private void decide(FusedVerdict verdict) {
        engine.decide(verdict).forEach(this::emit);
    }

    private void onTimer(SourceIdentity identity, long generation, Instant now) {
        engine.getStateMachine().onTimer(identity, generation, now).forEach(this::emit);
    }

    private void emit(TransitionOutcome outcome) {
        outcome.getAction().ifPresent(action -> enqueue(dispatchStage, action));
        outcome.getAlert().ifPresent(alert -> enqueue(dispatchStage, alert));
    }

    private void tick() {
        try {
            flushWindows();
            evictIdle();
        } catch (RuntimeException e) {
            metrics.increment(MetricNames.STAGE_ERRORS);
            LOG.error("Periodic flush failed", e);
        }
    }

    private <T> boolean enqueue(PartitionedStage<T> stage, T item) {
        try {
            stage.put(item);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while handing {} to stage {}; dropped", item, stage.getName());
            return false;
        }
    }

    private IngestResult malformed(String reason) {
        metrics.increment(MetricNames.INGEST_MALFORMED);
        long total = malformed.incrementAndGet();
        if (total == 1 || total % 1000 == 0) {
            LOG.warn("Dropping malformed flow event ({} so far): {}", total, reason);
        } else {
            LOG.debug("Dropping malformed flow event: {}", reason);
        }
        return IngestResult.MALFORMED;
    }
}
