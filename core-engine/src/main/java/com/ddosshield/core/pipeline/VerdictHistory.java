package com.ddosshield.core.pipeline;

import com.ddosshield.core.model.FusedVerdict;
import com.ddosshield.core.model.SourceIdentity;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The last few verdicts per identity, for the query interface. Bounded in
 * both directions: verdicts per identity and identities overall.
 */
public class VerdictHistory {

    private final int perIdentity;
    private final Map<SourceIdentity, Deque<FusedVerdict>> history;

    public VerdictHistory(int perIdentity, int maxIdentities) {
        if (perIdentity <= 0) {
            throw new IllegalArgumentException("perIdentity must be > 0, got: " + perIdentity);
        }
        if (maxIdentities <= 0) {
            throw new IllegalArgumentException("maxIdentities must be > 0, got: " + maxIdentities);
        }
        this.perIdentity = perIdentity;
        this.history = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<SourceIdentity, Deque<FusedVerdict>> eldest) {
                return size() > maxIdentities;
            }
        };
    }

    public synchronized void record(FusedVerdict verdict) {
        Objects.requireNonNull(verdict, "verdict must not be null");
        Deque<FusedVerdict> verdicts = history.computeIfAbsent(verdict.getIdentity(), id -> new ArrayDeque<>());
        if (verdicts.size() >= perIdentity) {
            verdicts.pollFirst();
        }
        verdicts.addLast(verdict);
    }

    /**
     * @return recent verdicts, oldest first; empty for unknown identities
     */
    public synchronized List<FusedVerdict> recent(SourceIdentity identity) {
        Deque<FusedVerdict> verdicts = history.get(identity);
        return verdicts == null ? List.of() : List.copyOf(verdicts);
    }

    public synchronized void forget(SourceIdentity identity) {
        history.remove(identity);
    }
}
