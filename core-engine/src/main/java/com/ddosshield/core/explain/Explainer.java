package com.ddosshield.core.explain;

import com.ddosshield.core.config.ExplainSettings;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.metrics.ShieldMetrics;
import com.ddosshield.core.model.Explanation;
import com.ddosshield.core.model.FeatureContribution;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.model.ModelScore;
import com.ddosshield.core.scoring.ModelExecutor;
import com.ddosshield.core.scoring.RegisteredModel;
import com.ddosshield.core.scoring.ScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
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
 * Attributes a flagged verdict to the features that drove it.
 *
 * <h3>Technique</h3>
 * <p>
 * Occlusion against a benign baseline: for every attributable model that
 * responded and every feature it uses, the feature is replaced by the
 * model's baseline value and the model is re-scored. The score drop is that
 * feature's contribution, weighted by the model's fusion weight and
 * normalized over the attributable weight. Deterministic models make the
 * result reproducible; results are also cached per verdict.
 * </p>
 *
 * <h3>Bounds</h3>
 * <ul>
 * <li>Only verdicts at or above the suspicious threshold are explained.</li>
 * <li>If the required evaluations exceed {@code sampleBudget}, or the time
 * budget runs out, the result is an unavailable marker.</li>
 * <li>Re-evaluations run on the models' pools in the {@link ModelExecutor};
 * the caller waits at most for what is left of the time budget.</li>
 * <li>Models that do not support attribution are skipped; if none is left
 * the result is an unavailable marker.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class Explainer {

    private static final Logger LOG = LoggerFactory.getLogger(Explainer.class);

    private static final Comparator<FeatureContribution> BY_IMPORTANCE = Comparator
            .comparingDouble((FeatureContribution c) -> Math.abs(c.getWeight())).reversed()
            .thenComparing(FeatureContribution::getFeature);

    private final List<RegisteredModel> models;
    private final ExplainSettings settings;
    private final double suspiciousThreshold;
    private final Duration timeout;
    private final Clock clock;
    private final ShieldMetrics metrics;
    private final ModelExecutor executor;
    private final Map<String, Explanation> cache;

    /**
     * @param models              registered models; only attributable ones are used
     * @param settings            explain section of the configuration
     * @param suspiciousThreshold verdicts below this score are not explained
     * @param clock               time source for model deadlines
     * @param metrics             metrics sink
     * @param executor            pools the re-evaluations run on
     */
    public Explainer(List<RegisteredModel> models, ExplainSettings settings, double suspiciousThreshold,
            Clock clock, ShieldMetrics metrics, ModelExecutor executor) {
        this.models = List.copyOf(Objects.requireNonNull(models, "models must not be null"));
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.suspiciousThreshold = suspiciousThreshold;
        this.timeout = settings.timeout();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        int cacheSize = settings.getCacheSize();
        this.cache = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Explanation> eldest) {
                return size() > cacheSize;
            }
        });
    }

    /**
     * @param verdict verdict to explain
     * @return {@code true} if {@link #explain(FusedVerdict)} would attempt an
     *         attribution for the verdict
     */
    public boolean isEligible(FusedVerdict verdict) {
        return settings.isEnabled() && verdict.getScore() >= suspiciousThreshold;
    }

    /**
     * Explain a verdict.
     *
     * @param verdict verdict to explain
     * @return ordered contributions, or an unavailable marker; never
     *         {@code null}
     */
    public Explanation explain(FusedVerdict verdict) {
        Objects.requireNonNull(verdict, "verdict must not be null");
        String verdictId = verdict.getVerdictId();

        if (!settings.isEnabled()) {
            return unavailable(verdictId, "explanations are disabled");
        }
        if (verdict.getScore() < suspiciousThreshold) {
            return unavailable(verdictId, "score " + verdict.getScore() + " is below the suspicious threshold");
        }
        Explanation cached = cache.get(verdictId);
        if (cached != null) {
            return cached;
        }

        FeatureVector vector = verdict.getVector();
        List<Attributable> candidates = attributable(verdict);
        if (candidates.isEmpty()) {
            return unavailable(verdictId, "no responding model supports attribution");
        }

        int required = 0;
        for (Attributable candidate : candidates) {
            for (String feature : candidate.model.baseline().keySet()) {
                if (vector.getFeature(feature).isPresent()) {
                    required++;
                }
            }
        }
        if (required > settings.getSampleBudget()) {
            return unavailable(verdictId, "sample budget of " + settings.getSampleBudget()
                    + " exceeded, " + required + " evaluations needed");
        }

        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        Instant modelDeadline = clock.instant().plus(timeout);
        Map<String, Double> raw = new LinkedHashMap<>();
        double attributedWeight = 0.0;
        int evaluations = 0;

        for (Attributable candidate : candidates) {
            Map<String, Double> deltas = new LinkedHashMap<>();
            String skipReason = null;
            for (Map.Entry<String, Double> base : candidate.model.baseline().entrySet()) {
                if (vector.getFeature(base.getKey()).isEmpty()) {
                    continue;
                }
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    return timeBudgetExhausted(verdictId);
                }
                FeatureVector occluded = vector.withFeature(base.getKey(), base.getValue());
                Future<ModelScore> future;
                try {
                    future = executor.submit(candidate.model, occluded, modelDeadline);
                } catch (RejectedExecutionException e) {
                    skipReason = "model pool rejected the call";
                    break;
                }
                try {
                    double perturbed = future.get(remaining, TimeUnit.NANOSECONDS).getScore();
                    evaluations++;
                    deltas.put(base.getKey(), candidate.score - perturbed);
                } catch (TimeoutException e) {
                    future.cancel(true);
                    return timeBudgetExhausted(verdictId);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    skipReason = cause.getClass().getSimpleName() + ": " + cause.getMessage();
                    break;
                } catch (InterruptedException e) {
                    future.cancel(true);
                    Thread.currentThread().interrupt();
                    return unavailable(verdictId, "interrupted");
                }
            }
            if (skipReason != null) {
                LOG.debug("Skipping model {} for attribution of {}: {}",
                        candidate.model.getModelId(), verdictId, skipReason);
                continue;
            }
            attributedWeight += candidate.weight;
            deltas.forEach((feature, delta) -> raw.merge(feature, candidate.weight * delta, Double::sum));
        }

        if (attributedWeight <= 0.0) {
            return unavailable(verdictId, "no model could be re-evaluated");
        }

        List<FeatureContribution> contributions = new ArrayList<>(raw.size());
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            contributions.add(new FeatureContribution(entry.getKey(), entry.getValue() / attributedWeight));
        }
        contributions.sort(BY_IMPORTANCE);
        List<FeatureContribution> top = contributions.size() > settings.getTopFeatures()
                ? contributions.subList(0, settings.getTopFeatures())
                : contributions;

        Explanation explanation = Explanation.of(verdictId, top, evaluations);
        cache.put(verdictId, explanation);
        metrics.increment(MetricNames.EXPLAIN_COMPUTED);
        return explanation;
    }

    private List<Attributable> attributable(FusedVerdict verdict) {
        Map<String, ModelScore> byId = new LinkedHashMap<>();
        for (ModelScore score : verdict.getModelScores()) {
            byId.put(score.getModelId(), score);
        }
        List<Attributable> out = new ArrayList<>();
        for (RegisteredModel registered : models) {
            ModelScore score = byId.get(registered.getModelId());
            if (registered.getWeight() > 0.0
                    && registered.getModel().supportsAttribution()
                    && score != null && !score.isFailed()) {
                out.add(new Attributable(registered.getModel(), registered.getWeight(), score.getScore()));
            }
        }
        return out;
    }

    private Explanation timeBudgetExhausted(String verdictId) {
        return unavailable(verdictId, "time budget of " + timeout.toMillis() + " ms exhausted");
    }

    private Explanation unavailable(String verdictId, String reason) {
        metrics.increment(MetricNames.EXPLAIN_UNAVAILABLE);
        LOG.debug("Explanation for {} unavailable: {}", verdictId, reason);
        return Explanation.unavailable(verdictId, reason);
    }

    private static final class Attributable {
        final ScoringModel model;
        final double weight;
        final double score;

        Attributable(ScoringModel model, double weight, double score) {
            this.model = model;
            this.weight = weight;
            this.score = score;
        }
    }
}
