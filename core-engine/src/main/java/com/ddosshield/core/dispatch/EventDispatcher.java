package com.ddosshield.core.dispatch;

import com.ddosshield.core.concurrent.ExecutorFactories;
import com.ddosshield.core.config.DispatchSettings;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.metrics.ShieldMetrics;
import com.ddosshield.core.model.ActionKind;
import com.ddosshield.core.model.AlertEvent;
import com.ddosshield.core.model.MitigationAction;
import com.ddosshield.core.model.ShieldEvent;
import com.ddosshield.core.model.SourceIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Delivers mitigation actions and alerts to their collaborators.
 *
 * <h3>Delivery</h3>
 * <ul>
 * <li>{@code watch} actions are internal bookkeeping and are only logged.</li>
 * <li>{@code block} and {@code unblock} actions for the same identity are
 * delivered strictly in dispatch order: a later action waits until the
 * earlier one is delivered or dropped.</li>
 * <li>The first attempt runs on the calling thread. Retries run on a
 * scheduler after an exponential backoff, so a failing collaborator never
 * stalls the caller.</li>
 * <li>After {@code maxAttempts} the event is logged as undelivered, kept in
 * a bounded record list and dropped.</li>
 * </ul>
 *
 * <p>
 * Delivery failures never feed back into the state machine: the decision
 * already stands.
 * </p>
 *
 * @since 1.0.0
 */
public class EventDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EventDispatcher.class);

    private final DispatchSettings settings;
    private final EnforcementGateway gateway;
    private final AlertChannel channel;
    private final ShieldMetrics metrics;
    private final Clock clock;
    private final ScheduledExecutorService retryScheduler;

    /** Pending actions per identity; the head is in flight. */
    private final Map<SourceIdentity, Deque<Delivery>> actionQueues = new HashMap<>();
    private final Deque<UndeliveredEvent> undelivered = new ArrayDeque<>();

    public EventDispatcher(DispatchSettings settings, EnforcementGateway gateway, AlertChannel channel,
            ShieldMetrics metrics, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.retryScheduler = ExecutorFactories.newScheduler("shield-dispatch-retry");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Deliver one event. Returns once the first attempt has been made or the
     * event has been queued behind an earlier action for the same identity.
     *
     * @param event a {@link MitigationAction} or an {@link AlertEvent}
     * @throws IllegalArgumentException for any other event type
     */
    public void dispatch(ShieldEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (event instanceof MitigationAction action) {
            if (action.getAction() == ActionKind.WATCH) {
                LOG.info("WATCH {} ({})", action.getSourceIdentity(), action.getReason());
                return;
            }
            Delivery delivery = new Delivery(action);
            boolean head;
            synchronized (actionQueues) {
                Deque<Delivery> queue = actionQueues.computeIfAbsent(action.getSourceIdentity(),
                        id -> new ArrayDeque<>());
                queue.addLast(delivery);
                head = queue.size() == 1;
            }
            if (head) {
                attempt(delivery);
            } else {
                LOG.debug("Queued {} for {} behind an earlier action", action.getAction(),
                        action.getSourceIdentity());
            }
        } else if (event instanceof AlertEvent alert) {
            attempt(new Delivery(alert));
        } else {
            throw new IllegalArgumentException("Unsupported event type: " + event.getClass().getName());
        }
    }

    /**
     * @return records of dropped events, oldest first
     */
    public List<UndeliveredEvent> undelivered() {
        synchronized (undelivered) {
            return List.copyOf(undelivered);
        }
    }

    /**
     * @return actions waiting for delivery, including those in flight
     */
    public int pendingActions() {
        synchronized (actionQueues) {
            return actionQueues.values().stream().mapToInt(Deque::size).sum();
        }
    }

    @Override
    public void close() {
        int pending = pendingActions();
        if (pending > 0) {
            LOG.warn("Closing dispatcher with {} action(s) still pending delivery", pending);
        }
        ExecutorFactories.shutdown(retryScheduler, "shield-dispatch-retry");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void attempt(Delivery delivery) {
        delivery.attempts++;
        try {
            if (delivery.event instanceof MitigationAction action) {
                gateway.enforce(action);
            } else {
                channel.publish((AlertEvent) delivery.event);
            }
        } catch (RuntimeException e) {
            onFailure(delivery, e);
            return;
        }
        metrics.increment(MetricNames.DISPATCH_DELIVERED);
        if (delivery.attempts > 1) {
            LOG.info("Delivered {} for {} after {} attempts", describe(delivery.event),
                    delivery.event.getSourceIdentity(), delivery.attempts);
        }
        finished(delivery);
    }

    private void onFailure(Delivery delivery, RuntimeException error) {
        delivery.lastError = error.getClass().getSimpleName() + ": " + error.getMessage();
        if (delivery.attempts >= settings.getMaxAttempts()) {
            giveUp(delivery);
            finished(delivery);
            return;
        }
        Duration backoff = settings.backoffAfter(delivery.attempts);
        metrics.increment(MetricNames.DISPATCH_RETRY);
        LOG.warn("Delivery of {} for {} failed (attempt {}/{}), retrying in {} ms: {}",
                describe(delivery.event), delivery.event.getSourceIdentity(), delivery.attempts,
                settings.getMaxAttempts(), backoff.toMillis(), delivery.lastError);
        try {
            retryScheduler.schedule(() -> attempt(delivery), backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            giveUp(delivery);
            finished(delivery);
        }
    }

    private void giveUp(Delivery delivery) {
        UndeliveredEvent record = new UndeliveredEvent(delivery.event, delivery.attempts, delivery.lastError,
                clock.instant());
        synchronized (undelivered) {
            if (undelivered.size() >= settings.getUndeliveredCapacity()) {
                undelivered.pollFirst();
            }
            undelivered.addLast(record);
        }
        metrics.increment(MetricNames.DISPATCH_UNDELIVERED);
        LOG.error("UNDELIVERED {} for {} after {} attempt(s), dropping: {}", describe(delivery.event),
                delivery.event.getSourceIdentity(), delivery.attempts, delivery.lastError);
    }

    /** Release the identity's queue and start the next queued action. */
    private void finished(Delivery delivery) {
        if (!(delivery.event instanceof MitigationAction)) {
            return;
        }
        SourceIdentity identity = delivery.event.getSourceIdentity();
        Delivery next;
        synchronized (actionQueues) {
            Deque<Delivery> queue = actionQueues.get(identity);
            if (queue == null) {
                return;
            }
            queue.pollFirst();
            next = queue.peekFirst();
            if (next == null) {
                actionQueues.remove(identity);
            }
        }
        if (next != null) {
            Delivery toSend = next;
            try {
                retryScheduler.execute(() -> attempt(toSend));
            } catch (RejectedExecutionException e) {
                attempt(toSend);
            }
        }
    }

    private static String describe(ShieldEvent event) {
        if (event instanceof MitigationAction action) {
            return action.getAction() + " action " + action.getActionId();
        }
        return "alert " + event.getEventId();
    }

    private static final class Delivery {
        final ShieldEvent event;
        volatile int attempts;
        volatile String lastError;

        Delivery(ShieldEvent event) {
            this.event = event;
        }
    }
}
