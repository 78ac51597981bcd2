package com.ddosshield.core.pipeline;

import java.util.Map;

/**
 * Point-in-time summary for dashboards.
 */
public final class ShieldStats {

    private final int trackedSources;
    private final int openWindows;
    private final long suspicious;
    private final long blocked;
    private final long recovering;
    private final Map<String, Long> counters;

    ShieldStats(int trackedSources, int openWindows, long suspicious, long blocked, long recovering,
            Map<String, Long> counters) {
        this.trackedSources = trackedSources;
        this.openWindows = openWindows;
        this.suspicious = suspicious;
        this.blocked = blocked;
        this.recovering = recovering;
        this.counters = Map.copyOf(counters);
    }

    /** Sources with a mitigation state. */
    public int getTrackedSources() {
        return trackedSources;
    }

    /** Sources with an open aggregation window. */
    public int getOpenWindows() {
        return openWindows;
    }

    public long getSuspicious() {
        return suspicious;
    }

    public long getBlocked() {
        return blocked;
    }

    public long getRecovering() {
        return recovering;
    }

    /**
     * @return engine counters by metric name
     */
    public Map<String, Long> getCounters() {
        return counters;
    }

    public long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }

    @Override
    public String toString() {
        return "ShieldStats{tracked=" + trackedSources + ", openWindows=" + openWindows
                + ", suspicious=" + suspicious + ", blocked=" + blocked + ", recovering=" + recovering + '}';
    }
}
