package com.ddosshield.core.metrics;

/**
 * Metric names emitted by the engine.
 */
public final class MetricNames {

    public static final String INGEST_ACCEPTED = "ingest.accepted";
    public static final String INGEST_BUSY = "ingest.busy";
    public static final String INGEST_MALFORMED = "ingest.malformed";

    public static final String AGGREGATION_LATE = "aggregation.late";
    public static final String AGGREGATION_EVICTED = "aggregation.capacity.evicted";
    public static final String AGGREGATION_VECTORS = "aggregation.vectors";

    public static final String SCORING_VERDICTS = "scoring.verdicts";
    public static final String SCORING_MODEL_FAILED = "scoring.model.failed";
    public static final String SCORING_MODEL_TIMEOUT = "scoring.model.timeout";
    public static final String SCORING_DEGRADED = "scoring.degraded";
    public static final String SCORING_FALLBACK = "scoring.fallback";
    public static final String SCORING_LATENCY_MS = "scoring.latency.ms";

    public static final String EXPLAIN_COMPUTED = "explain.computed";
    public static final String EXPLAIN_UNAVAILABLE = "explain.unavailable";

    public static final String STATE_EVICTED = "state.capacity.evicted";
    public static final String STATE_IDLE_EVICTED = "state.idle.evicted";

    public static final String MITIGATION_SUSPICIOUS = "mitigation.suspicious";
    public static final String MITIGATION_BLOCK = "mitigation.block";
    public static final String MITIGATION_UNBLOCK = "mitigation.unblock";
    public static final String MITIGATION_CLEARED = "mitigation.cleared";
    public static final String MITIGATION_RELAPSE = "mitigation.relapse";

    public static final String DISPATCH_DELIVERED = "dispatch.delivered";
    public static final String DISPATCH_RETRY = "dispatch.retry";
    public static final String DISPATCH_UNDELIVERED = "dispatch.undelivered";

    public static final String STAGE_ERRORS = "pipeline.stage.errors";

    private MetricNames() {
        // constants only
    }
}
