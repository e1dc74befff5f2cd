package org.carball.querymon.scheduling;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} backed by a single daemon thread.
 */
@Slf4j
public class ExecutorTaskScheduler implements TaskScheduler {

    private final ScheduledExecutorService scheduler;

    public ExecutorTaskScheduler() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "query-monitor-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(String name, Runnable task, Duration interval) {
        long periodMs = interval.toMillis();
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(
                () -> runSafely(name, task),
                periodMs,
                periodMs,
                TimeUnit.MILLISECONDS
        );
        log.debug("Scheduled '{}' every {}ms", name, periodMs);
        return new FutureTask(name, future);
    }

    private static void runSafely(String name, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            // a thrown exception would silently cancel the repeating future
            log.error("Scheduled task '{}' failed", name, e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class FutureTask implements ScheduledTask {
        private final String name;
        private final ScheduledFuture<?> future;

        private FutureTask(String name, ScheduledFuture<?> future) {
            this.name = name;
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
            log.debug("Cancelled '{}'", name);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
