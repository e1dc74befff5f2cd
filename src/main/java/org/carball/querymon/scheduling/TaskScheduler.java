package org.carball.querymon.scheduling;

import java.time.Duration;

/**
 * Runs repeating background work. Implementations must not let an exception thrown by
 * one execution cancel the following ones.
 */
public interface TaskScheduler extends AutoCloseable {

    ScheduledTask scheduleAtFixedRate(String name, Runnable task, Duration interval);

    @Override
    void close();
}
