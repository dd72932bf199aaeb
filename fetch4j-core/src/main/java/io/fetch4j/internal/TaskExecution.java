package io.fetch4j.internal;

import io.fetch4j.core.Task;

import java.time.Duration;

/**
 * Outcome of one {@link TaskExecutor#execute(Task)} call: either finished, or to be re-queued after a delay.
 */
public record TaskExecution(
        Task task,
        Duration retryDelay
) {

    public static TaskExecution completed(Task task) {
        return new TaskExecution(task, null);
    }

    public static TaskExecution retry(Task task, Duration delay) {
        return new TaskExecution(task, delay);
    }

    public boolean isRetry() {
        return retryDelay != null;
    }
}
