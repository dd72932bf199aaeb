package io.fetch4j;

import io.fetch4j.core.FetchStrategy;
import io.fetch4j.core.Job;
import io.fetch4j.core.TaskStatusView;
import io.fetch4j.core.UnscheduleResult;

import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Supports two ways of running fetches:
 * <ul>
 *   <li>Recurring jobs, declared as {@code hourly}, {@code daily}, {@code weekly} or
 *       {@code cron:minute,hour,day,month,weekday}</li>
 *   <li>One-off tasks for a single target or a batch of targets</li>
 * </ul>
 */
public interface FetchScheduler {
    void start();

    void stop();

    /**
     * Register a recurring job. A malformed recurrence is demoted to hourly, never rejected.
     *
     * @return the job id
     */
    String schedule(String target, String recurrence, FetchStrategy strategy);

    /**
     * Disable a job. Idempotent; in-flight tasks of the job are not cancelled.
     */
    UnscheduleResult unschedule(String jobId);

    /**
     * Active jobs, most recently created first.
     */
    List<Job> listActiveJobs();

    /**
     * Fetch one target now, bypassing the trigger cycle.
     *
     * @return the task id
     */
    String runImmediate(String target, FetchStrategy strategy);

    /**
     * Fetch several targets as one task whose status aggregates the per-target outcomes.
     *
     * @return the task id
     */
    String runBatch(List<String> targets, FetchStrategy strategy);

    /**
     * Non-blocking status poll.
     */
    TaskStatusView taskStatus(String taskId);
}
