package com.ddosshield.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Model registry and fusion settings ({@code scoring:} section).
 *
 * <pre>
 * scoring:
 *   totalDeadlineMillis: 250
 *   outageDecay: 0.5
 *   modelPoolThreads: 4
 *   modelPoolQueueCapacity: 32
 *   models:
 *     - id: logistic-v3
 *       type: logistic
 *       weight: 0.4
 *       timeoutMillis: 50
 *       artifact: classpath:models/logistic.json
 * </pre>
 */
public class ScoringSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private long totalDeadlineMillis = 250;
    private double outageDecay = 0.5;
    private int modelPoolThreads = 4;
    private int modelPoolQueueCapacity = 32;
    private List<ModelDefinition> models = new ArrayList<>();

    void validate(List<String> errors) {
        if (totalDeadlineMillis <= 0) {
            errors.add("scoring.totalDeadlineMillis must be > 0, got: " + totalDeadlineMillis);
        }
        if (!(outageDecay >= 0.0 && outageDecay <= 1.0)) {
            errors.add("scoring.outageDecay must be in [0, 1], got: " + outageDecay);
        }
        if (modelPoolThreads <= 0) {
            errors.add("scoring.modelPoolThreads must be > 0, got: " + modelPoolThreads);
        }
        if (modelPoolQueueCapacity <= 0) {
            errors.add("scoring.modelPoolQueueCapacity must be > 0, got: " + modelPoolQueueCapacity);
        }
        if (models.isEmpty()) {
            errors.add("scoring.models must define at least one model");
        }

        Set<String> ids = new HashSet<>();
        double enabledWeight = 0.0;
        for (int i = 0; i < models.size(); i++) {
            ModelDefinition model = models.get(i);
            if (model == null) {
                errors.add("scoring.models[" + i + "] is null");
                continue;
            }
            model.validate(errors);
            if (model.getId() != null && !ids.add(model.getId())) {
                errors.add("Duplicate model id: '" + model.getId() + "'");
            }
            if (model.isEnabled()) {
                enabledWeight += Math.max(0.0, model.getWeight());
            }
        }
        if (!models.isEmpty() && enabledWeight <= 0.0) {
            errors.add("scoring.models needs at least one enabled model with weight > 0");
        }
    }

    public Duration totalDeadline() {
        return Duration.ofMillis(totalDeadlineMillis);
    }

    /**
     * @return enabled models only, in declaration order
     */
    public List<ModelDefinition> enabledModels() {
        return models.stream().filter(ModelDefinition::isEnabled).toList();
    }

    public long getTotalDeadlineMillis() {
        return totalDeadlineMillis;
    }

    public void setTotalDeadlineMillis(long totalDeadlineMillis) {
        this.totalDeadlineMillis = totalDeadlineMillis;
    }

    public double getOutageDecay() {
        return outageDecay;
    }

    public void setOutageDecay(double outageDecay) {
        this.outageDecay = outageDecay;
    }

    /**
     * @return worker threads per model
     */
    public int getModelPoolThreads() {
        return modelPoolThreads;
    }

    public void setModelPoolThreads(int modelPoolThreads) {
        this.modelPoolThreads = modelPoolThreads;
    }

    public int getModelPoolQueueCapacity() {
        return modelPoolQueueCapacity;
    }

    public void setModelPoolQueueCapacity(int modelPoolQueueCapacity) {
        this.modelPoolQueueCapacity = modelPoolQueueCapacity;
    }

    /**
     * @return unmodifiable model list
     */
    public List<ModelDefinition> getModels() {
        return Collections.unmodifiableList(models);
    }

    public void setModels(List<ModelDefinition> models) {
        this.models = models != null ? new ArrayList<>(models) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "ScoringSettings{" +
                "totalDeadlineMillis=" + totalDeadlineMillis +
                ", outageDecay=" + outageDecay +
                ", modelPoolThreads=" + modelPoolThreads +
                ", modelPoolQueueCapacity=" + modelPoolQueueCapacity +
                ", models=" + models +
                '}';
    }
}
