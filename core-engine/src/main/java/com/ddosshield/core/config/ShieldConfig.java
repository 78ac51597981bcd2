package com.ddosshield.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the {@code shield.yml} configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * aggregation:
 *   windowSeconds: 10
 *   identityGranularity: address
 * scoring:
 *   models:
 *     - id: logistic-v3
 *       type: logistic
 *       weight: 0.4
 *       artifact: classpath:models/logistic.json
 * explain:
 *   sampleBudget: 256
 * mitigation:
 *   suspiciousThreshold: 0.5
 *   blockThreshold: 0.8
 * dispatch:
 *   maxAttempts: 5
 * pipeline:
 *   ingestQueueCapacity: 10000
 * </pre>
 *
 * <p>
 * Omitted sections fall back to their defaults. Call {@link #validate()}
 * after loading; the loader does this automatically.
 * </p>
 *
 * @since 1.0.0
 */
public class ShieldConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private AggregationSettings aggregation = new AggregationSettings();
    private ScoringSettings scoring = new ScoringSettings();
    private ExplainSettings explain = new ExplainSettings();
    private MitigationSettings mitigation = new MitigationSettings();
    private DispatchSettings dispatch = new DispatchSettings();
    private PipelineSettings pipeline = new PipelineSettings();

    /**
     * Validate every section of this configuration.
     *
     * <p>
     * Collects all errors and throws a single exception if any setting is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        aggregation.validate(errors);
        scoring.validate(errors);
        explain.validate(errors);
        mitigation.validate(errors);
        dispatch.validate(errors);
        pipeline.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Shield configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public AggregationSettings getAggregation() {
        return aggregation;
    }

    public void setAggregation(AggregationSettings aggregation) {
        this.aggregation = aggregation != null ? aggregation : new AggregationSettings();
    }

    public ScoringSettings getScoring() {
        return scoring;
    }

    public void setScoring(ScoringSettings scoring) {
        this.scoring = scoring != null ? scoring : new ScoringSettings();
    }

    public ExplainSettings getExplain() {
        return explain;
    }

    public void setExplain(ExplainSettings explain) {
        this.explain = explain != null ? explain : new ExplainSettings();
    }

    public MitigationSettings getMitigation() {
        return mitigation;
    }

    public void setMitigation(MitigationSettings mitigation) {
        this.mitigation = mitigation != null ? mitigation : new MitigationSettings();
    }

    public DispatchSettings getDispatch() {
        return dispatch;
    }

    public void setDispatch(DispatchSettings dispatch) {
        this.dispatch = dispatch != null ? dispatch : new DispatchSettings();
    }

    public PipelineSettings getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelineSettings pipeline) {
        this.pipeline = pipeline != null ? pipeline : new PipelineSettings();
    }

    @Override
    public String toString() {
        return "ShieldConfig{" +
                "aggregation=" + aggregation +
                ", scoring=" + scoring +
                ", mitigation=" + mitigation +
                '}';
    }
}
