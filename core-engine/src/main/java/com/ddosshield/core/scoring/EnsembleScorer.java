package com.ddosshield.core.scoring;

import com.ddosshield.core.error.ModelException;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.metrics.ShieldMetrics;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.model.ModelScore;
import com.ddosshield.core.model.SourceIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every registered model against a feature vector and fuses the
 * results into one {@link FusedVerdict}.
 *
 * <h3>Fan-out</h3>
 * <p>
 * All models are submitted at once, each to its own bounded pool in the
 * {@link ModelExecutor}. A call the pool rejects counts as a failed score.
 * Each result is awaited
 * until the earlier of the model's own timeout and the total scoring
 * deadline, both measured from submission, so total latency is bounded by
 * the slowest permitted model rather than the sum. A model that times out
 * or throws is recorded as a failed {@link ModelScore}; its task is
 * cancelled.
 * </p>
 *
 * <h3>Fusion</h3>
 * <p>
 * Weighted average of the successful scores, renormalized over the weights
 * of the models that responded. If no weighted model responded, the score
 * is the identity's last known score decayed toward 0.5 by
 * {@code outageDecay}, or exactly 0.5 without history. The fallback score
 * becomes the new last known score, so a long outage converges on 0.5 and
 * never on 0.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleScorer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleScorer.class);

    static final double NEUTRAL = 0.5;
    static final int DEFAULT_POOL_THREADS = 4;
    static final int DEFAULT_POOL_QUEUE = 32;

    private final List<RegisteredModel> models;
    private final Duration totalDeadline;
    private final double outageDecay;
    private final double totalWeight;
    private final Clock clock;
    private final ShieldMetrics metrics;
    private final ModelExecutor executor;
    private final boolean ownsExecutor;
    private final Map<SourceIdentity, Double> lastKnown;

    /**
     * Scorer with its own model pools of default size.
     *
     * @param models        registered models; at least one
     * @param totalDeadline upper bound on one scoring call
     * @param outageDecay   fraction of the distance to 0.5 removed per outage
     * @param historySize   maximum number of identities whose last score is kept
     * @param clock         time source for model deadlines
     * @param metrics       metrics sink
     */
    public EnsembleScorer(List<RegisteredModel> models, Duration totalDeadline, double outageDecay,
            int historySize, Clock clock, ShieldMetrics metrics) {
        this(models, totalDeadline, outageDecay, historySize, clock, metrics,
                new ModelExecutor(models, DEFAULT_POOL_THREADS, DEFAULT_POOL_QUEUE), true);
    }

    /**
     * Scorer running its models on a shared executor. The executor is not
     * closed by {@link #close()} unless {@code ownsExecutor} is set.
     */
    public EnsembleScorer(List<RegisteredModel> models, Duration totalDeadline, double outageDecay,
            int historySize, Clock clock, ShieldMetrics metrics, ModelExecutor executor, boolean ownsExecutor) {
        Objects.requireNonNull(models, "models must not be null");
        if (models.isEmpty()) {
            throw new IllegalArgumentException("At least one model is required");
        }
        if (!(outageDecay >= 0.0 && outageDecay <= 1.0)) {
            throw new IllegalArgumentException("outageDecay must be in [0, 1], got: " + outageDecay);
        }
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be > 0, got: " + historySize);
        }
        this.models = List.copyOf(models);
        this.totalDeadline = Objects.requireNonNull(totalDeadline, "totalDeadline must not be null");
        this.outageDecay = outageDecay;
        this.totalWeight = models.stream().mapToDouble(RegisteredModel::getWeight).sum();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.ownsExecutor = ownsExecutor;
        this.lastKnown = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<SourceIdentity, Double> eldest) {
                return size() > historySize;
            }
        });
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Score one vector with every model and fuse the results.
     *
     * @param vector vector to score
     * @return fused verdict; never {@code null}, even if every model failed
     */
    public FusedVerdict score(FeatureVector vector) {
        Objects.requireNonNull(vector, "vector must not be null");

        long started = System.nanoTime();
        long totalDeadlineNanos = started + totalDeadline.toNanos();
        Instant now = clock.instant();

        List<Future<ModelScore>> futures = new ArrayList<>(models.size());
        for (RegisteredModel registered : models) {
            Duration budget = registered.getTimeout().compareTo(totalDeadline) < 0
                    ? registered.getTimeout()
                    : totalDeadline;
            Instant modelDeadline = now.plus(budget);
            try {
                futures.add(executor.submit(registered.getModel(), vector, modelDeadline));
            } catch (RejectedExecutionException e) {
                futures.add(null);
            }
        }

        List<ModelScore> scores = new ArrayList<>(models.size());
        for (int i = 0; i < models.size(); i++) {
            RegisteredModel registered = models.get(i);
            long modelDeadlineNanos = Math.min(started + registered.getTimeout().toNanos(), totalDeadlineNanos);
            scores.add(await(registered, futures.get(i), started, modelDeadlineNanos));
        }

        FusedVerdict verdict = fuse(vector, scores);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        metrics.increment(MetricNames.SCORING_VERDICTS);
        metrics.observe(MetricNames.SCORING_LATENCY_MS, elapsedMillis);
        if (verdict.isDegraded()) {
            metrics.increment(MetricNames.SCORING_DEGRADED);
        }
        LOG.trace("Scored {} -> {} in {} ms", vector.getVectorId(), verdict.getScore(), elapsedMillis);
        return verdict;
    }

    /**
     * @param identity identity to look up
     * @return the last fused score kept for the identity, or {@code null}
     */
    public Double lastKnownScore(SourceIdentity identity) {
        return lastKnown.get(identity);
    }

    /**
     * Drop the identity's score history, e.g. after idle eviction.
     */
    public void forget(SourceIdentity identity) {
        lastKnown.remove(identity);
    }

    public List<RegisteredModel> getModels() {
        return models;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.close();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private ModelScore await(RegisteredModel registered, Future<ModelScore> future, long started,
            long deadlineNanos) {
        String modelId = registered.getModelId();
        if (future == null) {
            return failed(modelId, "rejected by saturated or stopped model pool", started,
                    MetricNames.SCORING_MODEL_FAILED);
        }
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            ModelScore score = future.get(remaining, TimeUnit.NANOSECONDS);
            return score.withLatency(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        } catch (TimeoutException e) {
            future.cancel(true);
            long budget = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - started);
            return failed(modelId, "timed out after " + budget + " ms", started, MetricNames.SCORING_MODEL_TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String reason = cause instanceof ModelException
                    ? cause.getMessage()
                    : cause.getClass().getSimpleName() + ": " + cause.getMessage();
            return failed(modelId, reason, started, MetricNames.SCORING_MODEL_FAILED);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return failed(modelId, "interrupted", started, MetricNames.SCORING_MODEL_FAILED);
        }
    }

    private ModelScore failed(String modelId, String reason, long started, String metric) {
        metrics.increment(metric);
        LOG.warn("Model [{}] failed: {}", modelId, reason);
        return ModelScore.failed(modelId, reason, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    }

    private FusedVerdict fuse(FeatureVector vector, List<ModelScore> scores) {
        double weighted = 0.0;
        double respondedWeight = 0.0;
        for (int i = 0; i < scores.size(); i++) {
            ModelScore score = scores.get(i);
            double weight = models.get(i).getWeight();
            if (!score.isFailed() && weight > 0.0) {
                weighted += weight * score.getScore();
                respondedWeight += weight;
            }
        }

        SourceIdentity identity = vector.getIdentity();
        if (respondedWeight > 0.0) {
            double fused = clamp(weighted / respondedWeight);
            lastKnown.put(identity, fused);
            double confidence = totalWeight > 0.0 ? clamp(respondedWeight / totalWeight) : 0.0;
            return new FusedVerdict(vector, fused, confidence, scores, false);
        }

        Double previous = lastKnown.get(identity);
        double fallback = previous == null
                ? NEUTRAL
                : clamp(NEUTRAL + (previous - NEUTRAL) * (1.0 - outageDecay));
        lastKnown.put(identity, fallback);
        metrics.increment(MetricNames.SCORING_FALLBACK);
        LOG.warn("No model responded for {}; using decayed score {} (previous: {})",
                identity, fallback, previous);
        return new FusedVerdict(vector, fallback, 0.0, scores, true);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
