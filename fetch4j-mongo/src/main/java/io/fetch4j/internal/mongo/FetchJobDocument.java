package io.fetch4j.internal.mongo;

import io.fetch4j.core.FetchStrategy;
import io.fetch4j.core.JobStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for recurring fetch jobs.
 */
@Document(collection = "fetch_jobs")
public class FetchJobDocument {

    @Id
    private String id;

    private String target;
    private String recurrence;
    private FetchStrategy strategy;
    private JobStatus status;
    private Instant createdAt;
    private Instant lastRun;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRun;

    public FetchJobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getRecurrence() {
        return recurrence;
    }

    public void setRecurrence(String recurrence) {
        this.recurrence = recurrence;
    }

    public FetchStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(FetchStrategy strategy) {
        this.strategy = strategy;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }

    public Instant getNextRun() {
        return nextRun;
    }

    public void setNextRun(Instant nextRun) {
        this.nextRun = nextRun;
    }
}
