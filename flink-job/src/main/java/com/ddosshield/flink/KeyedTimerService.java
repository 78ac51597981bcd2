package com.ddosshield.flink;

import com.ddosshield.core.mitigation.TimerService;
import com.ddosshield.core.model.SourceIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Bridges the state machine's {@link TimerService} onto Flink keyed
 * processing-time timers.
 *
 * <p>
 * Flink only lets a function register timers for the key currently being
 * processed, so the process function {@link #bind binds} the current key's
 * Flink timer service around every call into the engine. The generation a
 * timer was armed for is remembered here, operator-locally; Flink itself only
 * stores the timestamp.
 * </p>
 *
 * <p>
 * Cancelling never deletes the Flink timer, because a window-flush timer may
 * share the timestamp. A cancelled timer still fires and {@link #fire} then
 * reports nothing due. A request for an identity other than the bound key is
 * remembered but not registered; the transition then happens lazily on that
 * source's next verdict. Not thread-safe: Flink calls a keyed function from
 * one thread.
 * </p>
 */
public class KeyedTimerService implements TimerService {

    private static final Logger LOG = LoggerFactory.getLogger(KeyedTimerService.class);

    private final Map<SourceIdentity, Armed> armed = new HashMap<>();

    private org.apache.flink.streaming.api.TimerService bound;
    private SourceIdentity boundKey;

    /**
     * @param flinkTimers the current key's Flink timer service
     * @param key         the current key
     */
    public void bind(org.apache.flink.streaming.api.TimerService flinkTimers, SourceIdentity key) {
        this.bound = Objects.requireNonNull(flinkTimers, "flinkTimers must not be null");
        this.boundKey = Objects.requireNonNull(key, "key must not be null");
    }

    public void unbind() {
        this.bound = null;
        this.boundKey = null;
    }

    @Override
    public void schedule(SourceIdentity identity, long generation, Instant dueAt) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(dueAt, "dueAt must not be null");
        Armed current = armed.get(identity);
        if (current != null && current.generation > generation) {
            return;
        }
        long dueAtMillis = dueAt.toEpochMilli();
        armed.put(identity, new Armed(generation, dueAtMillis));
        if (bound != null && identity.equals(boundKey)) {
            bound.registerProcessingTimeTimer(dueAtMillis);
        } else {
            LOG.debug("Timer for {} requested outside its key context; will apply lazily", identity);
        }
    }

    @Override
    public void cancel(SourceIdentity identity) {
        armed.remove(identity);
    }

    /**
     * Claim the identity's mitigation timer if it is due.
     *
     * @param identity  key whose Flink timer fired
     * @param timestamp firing time in epoch millis
     * @return the generation the timer was armed for, or empty if nothing is
     *         due (a window-flush timer or a cancelled one)
     */
    public OptionalLong fire(SourceIdentity identity, long timestamp) {
        Armed current = armed.get(identity);
        if (current == null || current.dueAtMillis > timestamp) {
            return OptionalLong.empty();
        }
        armed.remove(identity);
        return OptionalLong.of(current.generation);
    }

    /** Number of identities with an armed timer. */
    public int pending() {
        return armed.size();
    }

    private static final class Armed {
        final long generation;
        final long dueAtMillis;

        Armed(long generation, long dueAtMillis) {
            this.generation = generation;
            this.dueAtMillis = dueAtMillis;
        }
    }
}
