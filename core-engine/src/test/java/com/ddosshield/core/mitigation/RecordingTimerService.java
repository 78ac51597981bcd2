package com.ddosshield.core.mitigation;

import com.ddosshield.core.model.SourceIdentity;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Keeps the armed timers in memory so tests can fire them by hand.
 */
class RecordingTimerService implements TimerService {

    static final class Armed {
        final long generation;
        final Instant dueAt;

        Armed(long generation, Instant dueAt) {
            this.generation = generation;
            this.dueAt = dueAt;
        }
    }

    final Map<SourceIdentity, Armed> armed = new HashMap<>();

    @Override
    public void schedule(SourceIdentity identity, long generation, Instant dueAt) {
        armed.put(identity, new Armed(generation, dueAt));
    }

    @Override
    public void cancel(SourceIdentity identity) {
        armed.remove(identity);
    }
}
