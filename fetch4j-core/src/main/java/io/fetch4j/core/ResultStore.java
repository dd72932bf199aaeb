package io.fetch4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable sink for result records and job definitions.
 *
 * <p>Results are append-only. Jobs are inserted once and afterwards only have their status and run times
 * updated. Implementations must be safe for concurrent use by worker threads.
 */
public interface ResultStore {

    /**
     * Append a record.
     *
     * @return the generated record id
     */
    String insertResult(ResultRecord record);

    /**
     * Insert a job; its {@code id} is ignored.
     *
     * @return the generated job id
     */
    String insertJob(Job job);

    /**
     * Update status and run times of a job. {@code lastRun} and {@code nextRun} are left untouched when null.
     *
     * @return modified count (0 or 1)
     */
    long updateJob(String jobId, JobStatus status, Instant lastRun, Instant nextRun);

    Optional<Job> findJob(String jobId);

    /**
     * Active jobs, most recently created first.
     */
    List<Job> listActiveJobs();

    /**
     * Result records, newest first.
     */
    List<ResultRecord> findRecentResults(int limit, int offset);

    StoreStatistics statistics();
}
