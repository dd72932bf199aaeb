package io.fetch4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A durable recurring fetch intent. Jobs are soft-disabled, never deleted.
 *
 * <p>{@code recurrence} is the effective schedule, i.e. after any fallback to hourly.
 */
public record Job(
        String id,
        String target,
        RecurrenceSpec recurrence,
        FetchStrategy strategy,
        JobStatus status,
        Instant createdAt,
        Instant lastRun,
        Instant nextRun
) {
    public Job {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(recurrence, "recurrence must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public boolean isActive() {
        return status == JobStatus.ACTIVE;
    }

    public boolean isDue(Instant now) {
        return isActive() && nextRun != null && !nextRun.isAfter(now);
    }

    public Job withId(String id) {
        return new Job(id, target, recurrence, strategy, status, createdAt, lastRun, nextRun);
    }

    public Job withStatus(JobStatus status) {
        return new Job(id, target, recurrence, strategy, status, createdAt, lastRun, nextRun);
    }

    public Job withRun(Instant lastRun, Instant nextRun) {
        return new Job(id, target, recurrence, strategy, status, createdAt, lastRun, nextRun);
    }
}
