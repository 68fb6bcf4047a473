package io.tokenkeeper.sdk.auth;

import java.time.Duration;

/**
 * Runs delayed tasks for the lifecycle manager. Abstracted so tests can drive time by hand.
 */
public interface TaskScheduler extends AutoCloseable {

    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Stops accepting tasks and cancels pending ones.
     */
    @Override
    void close();

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
