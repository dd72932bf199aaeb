package io.fetch4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One concrete execution, covering one target or a batch of targets.
 *
 * <p>Tasks are immutable snapshots; every state change produces a new instance.
 * {@code remaining} holds the targets still to be fetched, {@code completed} the records already written.
 */
public record Task(
        String id,
        String jobId,
        List<String> targets,
        List<String> remaining,
        FetchStrategy strategy,
        boolean batch,
        int attemptCount,
        TaskStatus status,
        List<ResultRecord> completed,
        String error,
        Instant createdAt,
        Instant updatedAt
) {
    public Task {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(status, "status must not be null");
        targets = List.copyOf(targets);
        remaining = List.copyOf(remaining);
        completed = completed == null ? List.of() : List.copyOf(completed);
    }

    /**
     * A single-target task, optionally spawned by a job.
     */
    public static Task single(String id, String jobId, String target, FetchStrategy strategy, Instant now) {
        List<String> targets = List.of(target);
        return new Task(id, jobId, targets, targets, strategy, false, 0, TaskStatus.PENDING, List.of(), null, now, now);
    }

    public static Task batch(String id, List<String> targets, FetchStrategy strategy, Instant now) {
        return new Task(id, null, targets, targets, strategy, true, 0, TaskStatus.PENDING, List.of(), null, now, now);
    }

    public Task running(Instant now) {
        return new Task(id, jobId, targets, remaining, strategy, batch, attemptCount, TaskStatus.RUNNING,
                completed, null, createdAt, now);
    }

    /**
     * Back to pending with the targets that still need another attempt.
     */
    public Task retrying(List<String> stillRemaining, List<ResultRecord> completedSoFar, Instant now) {
        return new Task(id, jobId, targets, stillRemaining, strategy, batch, attemptCount + 1, TaskStatus.PENDING,
                completedSoFar, null, createdAt, now);
    }

    /**
     * Terminal state derived from the per-target records: a single task succeeds when its record is a success,
     * a batch succeeds when at least one target succeeded.
     */
    public Task finished(List<ResultRecord> records, Instant now) {
        TaskResult r = TaskResult.of(records);
        boolean ok = batch ? r.successful() > 0 : (r.failed() == 0 && r.successful() > 0);
        return new Task(id, jobId, targets, List.of(), strategy, batch, attemptCount,
                ok ? TaskStatus.SUCCEEDED : TaskStatus.FAILED, records, null, createdAt, now);
    }

    /**
     * Terminal failure that happened outside of the per-target flow (e.g. the store rejected a write).
     */
    public Task failed(String error, Instant now) {
        return new Task(id, jobId, targets, remaining, strategy, batch, attemptCount, TaskStatus.FAILED,
                completed, error, createdAt, now);
    }

    public TaskResult result() {
        return TaskResult.of(completed);
    }
}
