package org.carball.querymon.support;

import org.carball.querymon.scheduling.ScheduledTask;
import org.carball.querymon.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scheduler whose tasks run only when a test calls {@link #runAll()}.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final List<Task> tasks = new ArrayList<>();
    private boolean closed;

    @Override
    public ScheduledTask scheduleAtFixedRate(String name, Runnable runnable, Duration interval) {
        Task task = new Task(name, runnable, interval);
        tasks.add(task);
        return task;
    }

    public void runAll() {
        for (Task task : new ArrayList<>(tasks)) {
            if (!task.cancelled) {
                task.runnable.run();
            }
        }
    }

    public List<Task> getActiveTasks() {
        List<Task> active = new ArrayList<>();
        for (Task task : tasks) {
            if (!task.cancelled) {
                active.add(task);
            }
        }
        return active;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public static final class Task implements ScheduledTask {
        private final String name;
        private final Runnable runnable;
        private final Duration interval;
        private boolean cancelled;

        private Task(String name, Runnable runnable, Duration interval) {
            this.name = name;
            this.runnable = runnable;
            this.interval = interval;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        public String getName() {
            return name;
        }

        public Duration getInterval() {
            return interval;
        }
    }
}
