package io.tokenkeeper.sdk.auth;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TaskScheduler} backed by a {@link ScheduledExecutorService} with daemon threads.
 */
public final class ExecutorTaskScheduler implements TaskScheduler {

    private static final Logger LOGGER = Logger.getLogger(ExecutorTaskScheduler.class.getName());
    private static final int DEFAULT_THREADS = 2;

    private final ScheduledExecutorService executor;

    public ExecutorTaskScheduler() {
        this(DEFAULT_THREADS);
    }

    public ExecutorTaskScheduler(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "tokenkeeper-refresh-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.executor = Executors.newScheduledThreadPool(threads, factory);
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        long millis = Math.max(0L, delay.toMillis());
        try {
            ScheduledFuture<?> future = executor.schedule(() -> {
                try {
                    task.run();
                } catch (RuntimeException ex) {
                    LOGGER.log(Level.SEVERE, "[tokenkeeper] scheduled task failed", ex);
                }
            }, millis, TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException ex) {
            LOGGER.fine(() -> "[tokenkeeper] scheduler is shut down, task dropped");
            return () -> {
            };
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
