package io.fetch4j.internal;

import io.fetch4j.Extractor;
import io.fetch4j.core.ExhaustedRetriesException;
import io.fetch4j.core.ExtractionResult;
import io.fetch4j.core.ExtractorRegistry;
import io.fetch4j.core.FetchException;
import io.fetch4j.core.ResultRecord;
import io.fetch4j.core.ResultStore;
import io.fetch4j.core.RetryPolicy;
import io.fetch4j.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one attempt of a task: fetches every remaining target and writes one {@link ResultRecord} per finished
 * target.
 *
 * <p>Targets are independent. A target whose failure is retryable and still within the {@link RetryPolicy}
 * budget is carried into the next attempt; every other failure is recorded as {@code "error: <cause>"}
 * right away. Only the records of finished targets are written, so a task leaves exactly one record per target.
 * A {@link ResultStore} failure is not classified; it propagates to the caller.
 */
public class TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final ExtractorRegistry extractors;
    private final ResultStore store;
    private final RetryPolicy retryPolicy;

    public TaskExecutor(ExtractorRegistry extractors, ResultStore store, RetryPolicy retryPolicy) {
        this.extractors = Objects.requireNonNull(extractors, "extractors must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }

    public TaskExecution execute(Task task) {
        Objects.requireNonNull(task, "task must not be null");

        List<ResultRecord> completed = new ArrayList<>(task.completed());
        List<String> retry = new ArrayList<>();

        for (String target : task.remaining()) {
            ExtractionResult result;
            try {
                result = fetch(task, target);
            } catch (FetchException | RuntimeException e) {
                if (retryPolicy.shouldRetry(task.attemptCount(), e)) {
                    log.warn("fetch failed, retrying task={} target={} attempt={} msg={}",
                            task.id(), target, task.attemptCount() + 1, e.getMessage());
                    retry.add(target);
                    continue;
                }

                if (retryPolicy.isRetryable(e)) {
                    ExhaustedRetriesException exhausted =
                            new ExhaustedRetriesException(target, task.attemptCount() + 1, e);
                    log.warn("fetch retries exhausted task={} msg={}", task.id(), exhausted.getMessage(), exhausted);
                } else {
                    log.warn("fetch failed terminally task={} target={} msg={}", task.id(), target, e.getMessage());
                }
                completed.add(persist(ResultRecord.failure(target, task.strategy(), e, Instant.now())));
                continue;
            }
            // store failures propagate and fail the whole task
            completed.add(persist(ResultRecord.of(result, Instant.now())));
        }

        Instant now = Instant.now();
        if (!retry.isEmpty()) {
            Duration delay = retryPolicy.delayFor(task.attemptCount());
            return TaskExecution.retry(task.retrying(retry, completed, now), delay);
        }
        return TaskExecution.completed(task.finished(completed, now));
    }

    private ExtractionResult fetch(Task task, String target) throws FetchException {
        Extractor extractor = extractors.getRequired(task.strategy());
        return extractor.fetch(target);
    }

    private ResultRecord persist(ResultRecord record) {
        String id = store.insertResult(record);
        return record.withId(id);
    }
}
