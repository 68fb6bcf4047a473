package io.tokenkeeper.sdk.auth;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ExecutorTaskSchedulerTest {

    @Test
    void runsTasksAfterDelay() {
        AtomicInteger runs = new AtomicInteger();
        try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler(1)) {
            scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(20));

            await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() == 1);
        }
    }

    @Test
    void cancelledTaskNeverRuns() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler(1)) {
            TaskScheduler.Cancellable cancellable = scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(200));
            cancellable.cancel();
            scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(400));

            await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() == 1);
            Thread.sleep(100);
            assertEquals(1, runs.get());
        }
    }

    @Test
    void failingTaskDoesNotKillScheduler() {
        AtomicInteger runs = new AtomicInteger();
        try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler(1)) {
            scheduler.schedule(() -> {
                throw new IllegalStateException("boom");
            }, Duration.ZERO);
            scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(10));

            await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() == 1);
        }
    }

    @Test
    void tasksScheduledAfterCloseAreDropped() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler(1);
        scheduler.close();

        scheduler.schedule(runs::incrementAndGet, Duration.ZERO).cancel();

        Thread.sleep(50);
        assertEquals(0, runs.get());
    }
}
