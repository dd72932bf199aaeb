package io.fetch4j.internal;

import io.fetch4j.FetchScheduler;
import io.fetch4j.config.FetchProperties;
import io.fetch4j.core.ExtractorRegistry;
import io.fetch4j.core.FetchStrategy;
import io.fetch4j.core.InvalidScheduleException;
import io.fetch4j.core.Job;
import io.fetch4j.core.JobStatus;
import io.fetch4j.core.RecurrenceSpec;
import io.fetch4j.core.ResultStore;
import io.fetch4j.core.RetryPolicy;
import io.fetch4j.core.Task;
import io.fetch4j.core.TaskStatusView;
import io.fetch4j.core.UnscheduleResult;
import io.fetch4j.utils.TriggerTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Store-agnostic fetch scheduler &amp; runner.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Recurring jobs (hourly / daily / weekly / five-field custom recurrence)</li>
 *   <li>One-off single-target and batch tasks</li>
 *   <li>Bounded worker pool with per-target retry and exponential backoff</li>
 * </ul>
 *
 * <p>The instance owns its job table: every active job is registered in memory and mirrored to the
 * {@link ResultStore}. A single ticker thread fires due jobs; changes to one job (tick, schedule, unschedule)
 * are serialized through {@link ConcurrentHashMap#compute}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * String jobId = scheduler.schedule("https://example.test/page", "hourly", FetchStrategy.STATIC);
 * String taskId = scheduler.runImmediate("https://example.test/other", FetchStrategy.SCRIPTED);
 * TaskStatusView status = scheduler.taskStatus(taskId);
 *
 * scheduler.unschedule(jobId);
 * scheduler.stop();
 * }</pre>
 */
public class DefaultFetchScheduler implements FetchScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultFetchScheduler.class);
    private static final String STOPPED_BEFORE_RUN = "scheduler stopped before the task ran";

    private final FetchProperties props;
    private final ResultStore store;
    private final TaskExecutor executor;
    private final RetryPolicy retryPolicy;
    private final WorkerPool workerPool;
    private final TaskRegistry tasks = new TaskRegistry();

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private Thread tickerThread;
    private int systemErrorCount = 0;

    public DefaultFetchScheduler(FetchProperties props, ResultStore store, ExtractorRegistry extractors) {
        this(props, store, extractors, Objects.requireNonNull(props, "props must not be null").retryPolicy());
    }

    public DefaultFetchScheduler(FetchProperties props, ResultStore store, ExtractorRegistry extractors,
                                 RetryPolicy retryPolicy) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.executor = new TaskExecutor(
                Objects.requireNonNull(extractors, "extractors must not be null"),
                store,
                retryPolicy
        );
        this.workerPool = new WorkerPool(props.getMaxConcurrency(), this::runTask);
    }

    /**
     * Reload active jobs, then start ticking and executing. Should be idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "fetch4j.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("fetch4j.processEvery must be a positive duration");
        }

        log.info("Fetch scheduler starting with processEvery={}, maxConcurrency={}, maxRetries={}, retryBaseDelay={}, timezone={}",
                props.getProcessEvery(),
                props.getMaxConcurrency(),
                retryPolicy.maxRetries(),
                retryPolicy.baseDelay(),
                props.getTimezone());

        try {
            reloadJobs();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        workerPool.start();

        if (tickerThread == null) {
            tickerThread = new Thread(this::tickerLoop);
            tickerThread.setName("fetch4j.ticker");
            tickerThread.setDaemon(true);
            tickerThread.start();
        }
        log.info("Fetch scheduler started successfully with {} active jobs.", jobs.size());
    }

    /**
     * Stop ticking and executing. Should be idempotent.
     *
     * <p>Tasks still waiting in the queue are marked failed so that no status poll is left unresolved.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Fetch scheduler stopping...");

        if (tickerThread != null) {
            tickerThread.interrupt();
            tickerThread = null;
        }

        List<Task> dropped = workerPool.stop(props.getShutdownTimeout());
        Instant now = nowInstant();
        for (Task task : dropped) {
            tasks.put(task.failed(STOPPED_BEFORE_RUN, now));
        }
        if (!dropped.isEmpty()) {
            log.warn("Fetch scheduler dropped {} queued tasks on stop", dropped.size());
        }
        log.info("Fetch scheduler stopped successfully.");
    }

    @Override
    public String schedule(String target, String recurrence, FetchStrategy strategy) {
        requireTarget(target);
        Objects.requireNonNull(strategy, "strategy must not be null");

        Instant now = nowInstant();
        RecurrenceSpec spec;
        Instant nextRun;
        try {
            spec = RecurrenceSpec.parse(recurrence);
            nextRun = TriggerTranslator.nextFire(spec, props.getTimezone(), now);
        } catch (InvalidScheduleException e) {
            log.warn("Invalid recurrence, falling back to hourly target={} msg={}", target, e.getMessage());
            spec = RecurrenceSpec.hourly();
            nextRun = TriggerTranslator.nextFire(spec, props.getTimezone(), now);
        }

        Job job = new Job(null, target, spec, strategy, JobStatus.ACTIVE, now, null, nextRun);
        String id = store.insertJob(job);
        jobs.put(id, job.withId(id));

        log.info("Scheduled job id={} target={} recurrence={} strategy={} nextRun={}",
                id, target, spec.expression(), strategy, nextRun);
        return id;
    }

    @Override
    public UnscheduleResult unschedule(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");

        AtomicReference<UnscheduleResult> result = new AtomicReference<>(UnscheduleResult.notFound());
        jobs.compute(jobId, (id, job) -> {
            if (job != null) {
                store.updateJob(id, JobStatus.INACTIVE, null, null);
                result.set(UnscheduleResult.disabled());
                return null;
            }
            // not registered here: may still be active in the store
            store.findJob(id).ifPresent(stored -> {
                if (stored.isActive()) {
                    store.updateJob(id, JobStatus.INACTIVE, null, null);
                    result.set(UnscheduleResult.disabled());
                } else {
                    result.set(UnscheduleResult.alreadyInactive());
                }
            });
            return null;
        });

        if (result.get().hasEffect()) {
            log.info("Unscheduled job id={}", jobId);
        } else {
            log.debug("Unschedule had no effect id={} matched={}", jobId, result.get().matched());
        }
        return result.get();
    }

    @Override
    public List<Job> listActiveJobs() {
        return store.listActiveJobs();
    }

    @Override
    public String runImmediate(String target, FetchStrategy strategy) {
        requireTarget(target);
        Objects.requireNonNull(strategy, "strategy must not be null");

        Task task = Task.single(newTaskId(), null, target, strategy, nowInstant());
        enqueue(task);
        return task.id();
    }

    @Override
    public String runBatch(List<String> targets, FetchStrategy strategy) {
        Objects.requireNonNull(targets, "targets must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("targets must not be empty");
        }
        targets.forEach(DefaultFetchScheduler::requireTarget);

        Task task = Task.batch(newTaskId(), targets, strategy, nowInstant());
        enqueue(task);
        return task.id();
    }

    @Override
    public TaskStatusView taskStatus(String taskId) {
        return tasks.view(taskId);
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    /**
     * Fire every active job whose next run is due at {@code now}.
     *
     * <p>The job's next run is recomputed and persisted before its task is queued, so a job fires at most once
     * per tick and missed slots collapse into a single run.
     *
     * @return number of tasks queued
     */
    int tick(Instant now) {
        int evicted = tasks.evictFinishedBefore(now.minus(props.getTaskRetention()));
        if (evicted > 0) {
            log.debug("Evicted finished tasks count={} tracked={}", evicted, tasks.size());
        }

        int fired = 0;
        for (String jobId : jobs.keySet()) {
            AtomicReference<Task> spawned = new AtomicReference<>();
            try {
                jobs.computeIfPresent(jobId, (id, job) -> {
                    if (!job.isDue(now)) {
                        return job;
                    }
                    Instant nextRun = computeNextRun(job, now);
                    store.updateJob(id, JobStatus.ACTIVE, now, nextRun);
                    spawned.set(Task.single(newTaskId(), id, job.target(), job.strategy(), now));
                    return job.withRun(now, nextRun);
                });
            } catch (RuntimeException e) {
                log.error("fetch4j tick failed for job id={} msg={}", jobId, e.getMessage(), e);
                continue;
            }

            if (spawned.get() != null) {
                log.debug("Job fired id={} task={}", jobId, spawned.get().id());
                enqueue(spawned.get());
                fired++;
            }
        }
        if (fired > 0) {
            log.debug("Tick fired={} queued={} running={}", fired, workerPool.queued(), workerPool.running());
        }
        return fired;
    }

    TaskRegistry tasks() {
        return tasks;
    }

    private void reloadJobs() {
        Instant now = nowInstant();
        for (Job job : store.listActiveJobs()) {
            Job registered = job;
            if (job.nextRun() == null) {
                registered = job.withRun(job.lastRun(), computeNextRun(job, now));
            }
            jobs.put(job.id(), registered);
        }
    }

    private Instant computeNextRun(Job job, Instant now) {
        Instant base = laterOf(job.nextRun(), now);
        try {
            return TriggerTranslator.nextFireAfter(job.recurrence(), props.getTimezone(), base);
        } catch (InvalidScheduleException e) {
            log.warn("Job recurrence cannot fire, falling back to hourly id={} msg={}", job.id(), e.getMessage());
            return TriggerTranslator.nextFireAfter(RecurrenceSpec.hourly(), props.getTimezone(), base);
        }
    }

    private void enqueue(Task task) {
        tasks.put(task);
        if (!workerPool.submit(task)) {
            log.warn("Task refused, worker pool is stopped id={}", task.id());
            tasks.put(task.failed(STOPPED_BEFORE_RUN, nowInstant()));
            return;
        }
        log.debug("Task queued id={} targets={} strategy={}", task.id(), task.targets().size(), task.strategy());
    }

    private void runTask(Task task) {
        Task running = task.running(nowInstant());
        tasks.put(running);
        log.debug("Task started id={} attempt={} remaining={}", task.id(), task.attemptCount(), task.remaining().size());

        try {
            TaskExecution execution = executor.execute(running);
            Task next = execution.task();
            tasks.put(next);

            if (execution.isRetry()) {
                if (!workerPool.submit(next, execution.retryDelay())) {
                    log.warn("Task retry refused, worker pool is stopped id={}", next.id());
                    tasks.put(next.failed(STOPPED_BEFORE_RUN, nowInstant()));
                    return;
                }
                log.info("Task retry scheduled id={} attempt={} delay={} targets={}",
                        next.id(), next.attemptCount(), execution.retryDelay(), next.remaining().size());
            } else {
                log.debug("Task finished id={} status={} successful={} failed={}",
                        next.id(), next.status(), next.result().successful(), next.result().failed());
            }
        } catch (Exception e) {
            log.error("fetch4j task failed id={} msg={}", task.id(), e.getMessage(), e);
            String cause = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            tasks.put(running.failed(cause, nowInstant()));
        }
    }

    private void tickerLoop() {
        while (started.get()) {
            try {
                tick(nowInstant());
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("fetch4j tick failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= 30) {
                    log.error("Fetch scheduler stopped due to repeated system failures...");
                    stop();
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);

                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                Thread.sleep(props.getProcessEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated tick failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    private static void requireTarget(String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target must not be blank");
        }
    }

    private static String newTaskId() {
        return UUID.randomUUID().toString();
    }
}
