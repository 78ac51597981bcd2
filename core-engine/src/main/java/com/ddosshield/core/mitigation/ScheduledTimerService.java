package com.ddosshield.core.mitigation;

import com.ddosshield.core.concurrent.ExecutorFactories;
import com.ddosshield.core.model.SourceIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TimerService} backed by a single-threaded scheduler.
 *
 * <p>
 * Callbacks run on the {@code shield-timer} thread and must not block for
 * long. Delays are computed against the supplied {@link Clock}.
 * </p>
 *
 * @since 1.0.0
 */
public class ScheduledTimerService implements TimerService, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduledTimerService.class);

    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<SourceIdentity, Armed> timers = new ConcurrentHashMap<>();
    private volatile TimerCallback callback;

    public ScheduledTimerService(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.scheduler = ExecutorFactories.newScheduler("shield-timer");
    }

    /**
     * Install the callback. Timers that fire before a callback is installed
     * are dropped with a warning.
     *
     * @param callback receiver of fired timers
     */
    public void start(TimerCallback callback) {
        this.callback = Objects.requireNonNull(callback, "callback must not be null");
    }

    @Override
    public void schedule(SourceIdentity identity, long generation, Instant dueAt) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(dueAt, "dueAt must not be null");
        Armed armed = new Armed(generation);
        Armed[] replaced = new Armed[1];
        Armed winner = timers.compute(identity, (id, existing) -> {
            if (existing != null && existing.generation > generation) {
                return existing;
            }
            replaced[0] = existing;
            return armed;
        });
        if (winner != armed) {
            LOG.trace("Ignoring stale timer request for {} gen {}", identity, generation);
            return;
        }
        if (replaced[0] != null) {
            replaced[0].cancel();
        }
        long delayMillis = Math.max(0L, Duration.between(clock.instant(), dueAt).toMillis());
        try {
            armed.future = scheduler.schedule(() -> fire(identity, armed), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            timers.remove(identity, armed);
            LOG.debug("Timer service stopped; not scheduling {} gen {}", identity, generation);
        }
    }

    @Override
    public void cancel(SourceIdentity identity) {
        Objects.requireNonNull(identity, "identity must not be null");
        Armed armed = timers.remove(identity);
        if (armed != null) {
            armed.cancel();
        }
    }

    /**
     * @return number of armed timers
     */
    public int pending() {
        return timers.size();
    }

    @Override
    public void close() {
        timers.clear();
        ExecutorFactories.shutdown(scheduler, "shield-timer");
    }

    private void fire(SourceIdentity identity, Armed armed) {
        if (!timers.remove(identity, armed)) {
            return;
        }
        TimerCallback target = callback;
        if (target == null) {
            LOG.warn("Timer for {} fired before a callback was installed; dropped", identity);
            return;
        }
        try {
            target.onTimer(identity, armed.generation, clock.instant());
        } catch (RuntimeException e) {
            LOG.error("Timer callback failed for {} gen {}", identity, armed.generation, e);
        }
    }

    private static final class Armed {
        final long generation;
        volatile ScheduledFuture<?> future;

        Armed(long generation) {
            this.generation = generation;
        }

        void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
