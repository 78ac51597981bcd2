package com.ddosshield.core.pipeline;

import com.ddosshield.core.concurrent.ExecutorFactories;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.metrics.ShieldMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A pipeline stage made of independent partitions, each a bounded queue
 * drained by one worker thread.
 *
 * <p>
 * Items are routed by the hash of their key, so items with equal keys are
 * handled by the same worker in submission order. Handler failures are
 * logged and counted; they never stop the worker.
 * </p>
 *
 * @param <T> item type
 * @since 1.0.0
 */
public final class PartitionedStage<T> implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PartitionedStage.class);

    static final long IDLE_POLL_MILLIS = 100L;

    private final String name;
    private final List<BlockingQueue<T>> queues;
    private final Function<? super T, ?> keyFunction;
    private final Consumer<? super T> handler;
    private final ShieldMetrics metrics;
    private final List<Thread> workers = new ArrayList<>();
    private volatile boolean running;

    /**
     * @param name        stage name, used for thread names and logs
     * @param partitions  number of partitions and workers
     * @param capacity    queue capacity per partition
     * @param keyFunction routing key of an item
     * @param handler     work done per item
     * @param metrics     metrics sink for handler failures
     */
    public PartitionedStage(String name, int partitions, int capacity, Function<? super T, ?> keyFunction,
            Consumer<? super T> handler, ShieldMetrics metrics) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (partitions <= 0) {
            throw new IllegalArgumentException("partitions must be > 0, got: " + partitions);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.keyFunction = Objects.requireNonNull(keyFunction, "keyFunction must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.queues = new ArrayList<>(partitions);
        for (int i = 0; i < partitions; i++) {
            queues.add(new ArrayBlockingQueue<>(capacity));
        }
    }

    /**
     * Start one worker per partition.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (running || !workers.isEmpty()) {
            throw new IllegalStateException("Stage " + name + " already started");
        }
        running = true;
        ThreadFactory factory = ExecutorFactories.named("shield-" + name);
        for (BlockingQueue<T> queue : queues) {
            Thread worker = factory.newThread(() -> drain(queue));
            workers.add(worker);
            worker.start();
        }
        LOG.info("Stage {} started with {} partition(s)", name, queues.size());
    }

    /**
     * Enqueue without waiting.
     *
     * @return {@code false} if the item's partition is full
     */
    public boolean offer(T item) {
        return partitionFor(item).offer(item);
    }

    /**
     * Enqueue, waiting while the item's partition is full.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void put(T item) throws InterruptedException {
        partitionFor(item).put(item);
    }

    /**
     * @return items waiting across all partitions
     */
    public int queued() {
        return queues.stream().mapToInt(BlockingQueue::size).sum();
    }

    public String getName() {
        return name;
    }

    /**
     * Stop accepting work, let workers drain their queues, and wait for them.
     */
    @Override
    public synchronized void close() {
        running = false;
        for (Thread worker : workers) {
            try {
                worker.join(TimeUnit.SECONDS.toMillis(5));
                if (worker.isAlive()) {
                    LOG.warn("Worker {} did not finish draining; interrupting", worker.getName());
                    worker.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while stopping stage {}", name);
                return;
            }
        }
        LOG.info("Stage {} stopped", name);
    }

    private BlockingQueue<T> partitionFor(T item) {
        Objects.requireNonNull(item, "item must not be null");
        Object key = keyFunction.apply(item);
        return queues.get(Math.floorMod(Objects.hashCode(key), queues.size()));
    }

    private void drain(BlockingQueue<T> queue) {
        MDC.put("stage", name);
        try {
            while (running || !queue.isEmpty()) {
                T item;
                try {
                    item = queue.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (item == null) {
                    continue;
                }
                try {
                    handler.accept(item);
                } catch (RuntimeException e) {
                    metrics.increment(MetricNames.STAGE_ERRORS);
                    LOG.error("Stage {} failed to handle {}", name, item, e);
                }
            }
        } finally {
            MDC.remove("stage");
        }
    }
}
