package com.ddosshield.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Stage sizing for the in-process pipeline ({@code pipeline:} section).
 *
 * <p>
 * Every stage is a set of partitions, each a bounded queue drained by one
 * worker thread. Events for the same source always land in the same
 * partition.
 * </p>
 */
public class PipelineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int ingestPartitions = 2;
    private int ingestQueueCapacity = 10_000;
    private int scoringPartitions = 4;
    private int scoringQueueCapacity = 1024;
    private int decisionPartitions = 2;
    private int decisionQueueCapacity = 1024;
    private int dispatchPartitions = 1;
    private int dispatchQueueCapacity = 1024;
    private long flushIntervalMillis = 1000;
    private int verdictHistorySize = 20;

    void validate(List<String> errors) {
        positive(errors, "ingestPartitions", ingestPartitions);
        positive(errors, "ingestQueueCapacity", ingestQueueCapacity);
        positive(errors, "scoringPartitions", scoringPartitions);
        positive(errors, "scoringQueueCapacity", scoringQueueCapacity);
        positive(errors, "decisionPartitions", decisionPartitions);
        positive(errors, "decisionQueueCapacity", decisionQueueCapacity);
        positive(errors, "dispatchPartitions", dispatchPartitions);
        positive(errors, "dispatchQueueCapacity", dispatchQueueCapacity);
        positive(errors, "flushIntervalMillis", flushIntervalMillis);
        positive(errors, "verdictHistorySize", verdictHistorySize);
    }

    private static void positive(List<String> errors, String name, long value) {
        if (value <= 0) {
            errors.add("pipeline." + name + " must be > 0, got: " + value);
        }
    }

    public Duration flushInterval() {
        return Duration.ofMillis(flushIntervalMillis);
    }

    public int getIngestPartitions() {
        return ingestPartitions;
    }

    public void setIngestPartitions(int ingestPartitions) {
        this.ingestPartitions = ingestPartitions;
    }

    public int getIngestQueueCapacity() {
        return ingestQueueCapacity;
    }

    public void setIngestQueueCapacity(int ingestQueueCapacity) {
        this.ingestQueueCapacity = ingestQueueCapacity;
    }

    public int getScoringPartitions() {
        return scoringPartitions;
    }

    public void setScoringPartitions(int scoringPartitions) {
        this.scoringPartitions = scoringPartitions;
    }

    public int getScoringQueueCapacity() {
        return scoringQueueCapacity;
    }

    public void setScoringQueueCapacity(int scoringQueueCapacity) {
        this.scoringQueueCapacity = scoringQueueCapacity;
    }

    public int getDecisionPartitions() {
        return decisionPartitions;
    }

    public void setDecisionPartitions(int decisionPartitions) {
        this.decisionPartitions = decisionPartitions;
    }

    public int getDecisionQueueCapacity() {
        return decisionQueueCapacity;
    }

    public void setDecisionQueueCapacity(int decisionQueueCapacity) {
        this.decisionQueueCapacity = decisionQueueCapacity;
    }

    public int getDispatchPartitions() {
        return dispatchPartitions;
    }

    public void setDispatchPartitions(int dispatchPartitions) {
        this.dispatchPartitions = dispatchPartitions;
    }

    public int getDispatchQueueCapacity() {
        return dispatchQueueCapacity;
    }

    public void setDispatchQueueCapacity(int dispatchQueueCapacity) {
        this.dispatchQueueCapacity = dispatchQueueCapacity;
    }

    public long getFlushIntervalMillis() {
        return flushIntervalMillis;
    }

    public void setFlushIntervalMillis(long flushIntervalMillis) {
        this.flushIntervalMillis = flushIntervalMillis;
    }

    public int getVerdictHistorySize() {
        return verdictHistorySize;
    }

    public void setVerdictHistorySize(int verdictHistorySize) {
        this.verdictHistorySize = verdictHistorySize;
    }
}
