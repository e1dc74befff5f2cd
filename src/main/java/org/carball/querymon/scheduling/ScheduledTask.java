package org.carball.querymon.scheduling;

/**
 * Handle to a repeating background task.
 */
public interface ScheduledTask {

    /**
     * Stops future executions. An execution already in progress is allowed to finish.
     */
    void cancel();

    boolean isCancelled();
}
