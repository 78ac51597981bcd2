package com.ddosshield.core.pipeline;

import com.ddosshield.core.aggregation.CapacityListener;
import com.ddosshield.core.aggregation.FeatureAggregator;
import com.ddosshield.core.config.ShieldConfig;
import com.ddosshield.core.explain.Explainer;
import com.ddosshield.core.metrics.ShieldMetrics;
import com.ddosshield.core.mitigation.MitigationStateMachine;
import com.ddosshield.core.mitigation.TimerService;
import com.ddosshield.core.mitigation.TransitionOutcome;
import com.ddosshield.core.model.AlertEvent;
import com.ddosshield.core.model.Explanation;
import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.scoring.EnsembleScorer;
import com.ddosshield.core.scoring.ModelExecutor;
import com.ddosshield.core.scoring.ModelFactory;
import com.ddosshield.core.scoring.RegisteredModel;
import com.ddosshield.core.state.SourceStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The decision core wired from configuration: aggregator, ensemble,
 * explainer, state store and state machine.
 *
 * <p>
 * Holds no threads of its own besides the per-model pools shared by the
 * ensemble and the explainer. Hosts
 * drive it: {@link MitigationPipeline} through bounded stages, the Flink
 * job from a keyed process function.
 * </p>
 *
 * @since 1.0.0
 */
public class ShieldEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ShieldEngine.class);

    private final ShieldConfig config;
    private final FeatureAggregator aggregator;
    private final ModelExecutor modelExecutor;
    private final EnsembleScorer scorer;
    private final Explainer explainer;
    private final SourceStateStore store;
    private final MitigationStateMachine stateMachine;

    /**
     * Build an engine whose models come from the configured registry.
     */
    public static ShieldEngine create(ShieldConfig config, Clock clock, ShieldMetrics metrics, TimerService timers,
            CapacityListener capacityListener) {
        List<RegisteredModel> models = ModelFactory.createAll(config.getScoring().getModels());
        return new ShieldEngine(config, models, clock, metrics, timers, capacityListener);
    }

    public ShieldEngine(ShieldConfig config, List<RegisteredModel> models, Clock clock, ShieldMetrics metrics,
            TimerService timers, CapacityListener capacityListener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(models, "models must not be null");
        this.aggregator = new FeatureAggregator(config.getAggregation(), metrics, capacityListener);
        this.modelExecutor = new ModelExecutor(models, config.getScoring().getModelPoolThreads(),
                config.getScoring().getModelPoolQueueCapacity());
        this.scorer = new EnsembleScorer(models, config.getScoring().totalDeadline(),
                config.getScoring().getOutageDecay(), config.getMitigation().getMaxTrackedSources(),
                clock, metrics, modelExecutor, false);
        this.explainer = new Explainer(models, config.getExplain(),
                config.getMitigation().getSuspiciousThreshold(), clock, metrics, modelExecutor);
        this.store = new SourceStateStore(config.getMitigation(), metrics, capacityListener);
        this.stateMachine = new MitigationStateMachine(config.getMitigation(), store, timers, metrics);
        LOG.info("Shield engine ready: window={}s granularity={} models={} thresholds={}/{} N={} M={}",
                config.getAggregation().getWindowSeconds(), aggregator.getGranularity(), models.size(),
                config.getMitigation().getSuspiciousThreshold(), config.getMitigation().getBlockThreshold(),
                config.getMitigation().getBlockConfirmations(), config.getMitigation().getClearConfirmations());
    }

    /**
     * Apply a verdict to the state machine and attach an explanation to any
     * alert it raised. Attribution runs after the state transition, outside
     * any store lock.
     *
     * @param verdict fused verdict
     * @return resulting transitions
     */
    public List<TransitionOutcome> decide(FusedVerdict verdict) {
        List<TransitionOutcome> outcomes = stateMachine.onVerdict(verdict);
        if (outcomes.isEmpty()) {
            return outcomes;
        }
        List<TransitionOutcome> explained = new ArrayList<>(outcomes.size());
        for (TransitionOutcome outcome : outcomes) {
            AlertEvent alert = outcome.getAlert().orElse(null);
            if (alert != null && alert.getVerdict() != null && explainer.isEligible(alert.getVerdict())) {
                Explanation explanation = explainer.explain(alert.getVerdict());
                outcome = outcome.withAlert(alert.withExplanation(explanation));
            }
            explained.add(outcome);
        }
        return explained;
    }

    public ShieldConfig getConfig() {
        return config;
    }

    public FeatureAggregator getAggregator() {
        return aggregator;
    }

    public EnsembleScorer getScorer() {
        return scorer;
    }

    public Explainer getExplainer() {
        return explainer;
    }

    public SourceStateStore getStore() {
        return store;
    }

    public MitigationStateMachine getStateMachine() {
        return stateMachine;
    }

    @Override
    public void close() {
        scorer.close();
        modelExecutor.close();
    }
}
