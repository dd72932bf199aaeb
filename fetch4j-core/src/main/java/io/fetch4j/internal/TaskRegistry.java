package io.fetch4j.internal;

import io.fetch4j.core.Task;
import io.fetch4j.core.TaskStatusView;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory view of task lifecycles, keyed by task id.
 */
public class TaskRegistry {

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();

    public void put(Task task) {
        tasks.put(task.id(), task);
    }

    public Optional<Task> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public TaskStatusView view(String taskId) {
        Task task = taskId == null ? null : tasks.get(taskId);
        return task == null ? TaskStatusView.unknown(taskId) : TaskStatusView.of(task);
    }

    /**
     * Drops finished tasks last updated before {@code cutoff}.
     *
     * @return number of evicted tasks
     */
    public int evictFinishedBefore(Instant cutoff) {
        int before = tasks.size();
        tasks.values().removeIf(t -> t.status().isTerminal() && t.updatedAt().isBefore(cutoff));
        return before - tasks.size();
    }

    public int size() {
        return tasks.size();
    }
}
