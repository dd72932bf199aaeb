package io.fetch4j.internal;

import io.fetch4j.core.Job;
import io.fetch4j.core.JobStatus;
import io.fetch4j.core.ResultRecord;
import io.fetch4j.core.ResultStore;
import io.fetch4j.core.StoreStatistics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Store used by the runtime tests. Keeps everything in memory.
 */
class InMemoryResultStore implements ResultStore {

    private final AtomicLong ids = new AtomicLong();
    private final List<ResultRecord> results = new CopyOnWriteArrayList<>();
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public String insertResult(ResultRecord record) {
        String id = "r" + ids.incrementAndGet();
        results.add(record.withId(id));
        return id;
    }

    @Override
    public String insertJob(Job job) {
        String id = "j" + ids.incrementAndGet();
        jobs.put(id, job.withId(id));
        return id;
    }

    @Override
    public long updateJob(String jobId, JobStatus status, Instant lastRun, Instant nextRun) {
        Job job = jobs.get(jobId);
        if (job == null) {
            return 0;
        }
        Job updated = job.withStatus(status).withRun(
                lastRun != null ? lastRun : job.lastRun(),
                nextRun != null ? nextRun : job.nextRun()
        );
        jobs.put(jobId, updated);
        return 1;
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<Job> listActiveJobs() {
        return jobs.values().stream()
                .filter(Job::isActive)
                .sorted(Comparator.comparing(Job::createdAt).reversed())
                .toList();
    }

    @Override
    public List<ResultRecord> findRecentResults(int limit, int offset) {
        List<ResultRecord> copy = new ArrayList<>(results);
        copy.sort(Comparator.comparing(ResultRecord::fetchedAt).reversed());
        return copy.stream().skip(offset).limit(limit).toList();
    }

    @Override
    public StoreStatistics statistics() {
        Map<String, Long> byStatus = new HashMap<>();
        Map<String, Long> byStrategy = new HashMap<>();
        for (ResultRecord r : results) {
            byStatus.merge(r.statusText(), 1L, Long::sum);
            byStrategy.merge(String.valueOf(r.strategyUsed()), 1L, Long::sum);
        }
        return new StoreStatistics(results.size(), byStatus, byStrategy, listActiveJobs().size());
    }

    List<ResultRecord> results() {
        return List.copyOf(results);
    }

    List<ResultRecord> resultsFor(String target) {
        return results.stream().filter(r -> r.target().equals(target)).toList();
    }

    /**
     * Seeds a job as if it had been persisted by an earlier process.
     */
    String seed(Job job) {
        return insertJob(job);
    }
}
