package com.ddosshield.core.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the engine's named daemon threads.
 *
 * @since 1.0.0
 */
public final class ExecutorFactories {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorFactories.class);

    private ExecutorFactories() {
        // utility class
    }

    /**
     * @param prefix thread-name prefix; threads are named {@code prefix-N}
     * @return factory producing daemon threads that log uncaught exceptions
     */
    public static ThreadFactory named(String prefix) {
        String threadPrefix = (prefix == null || prefix.isBlank()) ? "shield" : prefix;
        AtomicInteger index = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadPrefix + "-" + index.getAndIncrement());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler(
                    (t, ex) -> LOG.error("Uncaught exception on thread {}", t.getName(), ex));
            return thread;
        };
    }

    /**
     * Bounded pool for model calls. At most {@code maxThreads} threads run
     * and at most {@code queueCapacity} calls wait; further submissions are
     * rejected with {@link java.util.concurrent.RejectedExecutionException}.
     * Idle threads expire after 60s.
     *
     * @param prefix        thread-name prefix
     * @param maxThreads    maximum number of worker threads
     * @param queueCapacity maximum number of waiting calls
     * @return bounded executor
     */
    public static ThreadPoolExecutor newModelPool(String prefix, int maxThreads, int queueCapacity) {
        if (maxThreads <= 0) {
            throw new IllegalArgumentException("maxThreads must be > 0, got: " + maxThreads);
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0, got: " + queueCapacity);
        }
        ThreadPoolExecutor pool = new ThreadPoolExecutor(maxThreads, maxThreads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity), named(prefix), new ThreadPoolExecutor.AbortPolicy());
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    /**
     * Single-threaded scheduler that drops cancelled tasks from its queue.
     *
     * @param prefix thread-name prefix
     * @return scheduler
     */
    public static ScheduledExecutorService newScheduler(String prefix) {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, named(prefix));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return scheduler;
    }

    /**
     * Shut an executor down and wait briefly for running tasks.
     *
     * @param executor executor to stop; may be {@code null}
     * @param name     name used in log messages
     */
    public static void shutdown(ExecutorService executor, String name) {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                LOG.warn("Executor {} did not terminate within 2s", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while stopping executor {}", name);
        }
    }
}
