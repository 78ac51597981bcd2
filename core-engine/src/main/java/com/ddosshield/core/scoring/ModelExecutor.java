package com.ddosshield.core.scoring;

import com.ddosshield.core.concurrent.ExecutorFactories;
import com.ddosshield.core.model.FeatureVector;
import com.ddosshield.core.model.ModelScore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Runs model calls off the caller's thread, one bounded pool per model.
 *
 * <p>
 * A model that hangs and ignores interrupts keeps at most its own
 * {@code threadsPerModel} workers busy; further calls to it wait in a queue
 * of {@code queueCapacity} and are then rejected. Other models keep their
 * own workers. Shared by {@link EnsembleScorer} and the explainer.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelExecutor implements AutoCloseable {

    private final Map<String, ThreadPoolExecutor> pools = new LinkedHashMap<>();

    /**
     * @param models          models to create pools for
     * @param threadsPerModel worker threads per model
     * @param queueCapacity   waiting calls per model
     */
    public ModelExecutor(List<RegisteredModel> models, int threadsPerModel, int queueCapacity) {
        Objects.requireNonNull(models, "models must not be null");
        for (RegisteredModel registered : models) {
            pools.computeIfAbsent(registered.getModelId(), id -> ExecutorFactories.newModelPool(
                    "shield-model-" + id, threadsPerModel, queueCapacity));
        }
    }

    /**
     * Submit one scoring call.
     *
     * @param model    model to call
     * @param vector   vector to score
     * @param deadline deadline passed to the model
     * @return pending score
     * @throws RejectedExecutionException if the model's pool is saturated,
     *                                    shut down, or unknown
     */
    public Future<ModelScore> submit(ScoringModel model, FeatureVector vector, Instant deadline) {
        ThreadPoolExecutor pool = pools.get(model.getModelId());
        if (pool == null) {
            throw new RejectedExecutionException("No pool for model " + model.getModelId());
        }
        if (pool.getQueue().remainingCapacity() == 0) {
            // timed-out calls stay queued as cancelled futures until purged
            pool.purge();
        }
        return pool.submit(() -> model.score(vector, deadline));
    }

    /**
     * @param modelId model id
     * @return number of worker threads currently alive for the model
     */
    public int poolSize(String modelId) {
        ThreadPoolExecutor pool = pools.get(modelId);
        return pool == null ? 0 : pool.getPoolSize();
    }

    @Override
    public void close() {
        pools.forEach((id, pool) -> ExecutorFactories.shutdown(pool, "shield-model-" + id));
    }
}
