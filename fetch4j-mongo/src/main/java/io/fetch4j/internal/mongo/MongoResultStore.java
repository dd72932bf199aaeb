package io.fetch4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fetch4j.core.InvalidScheduleException;
import io.fetch4j.core.Job;
import io.fetch4j.core.JobStatus;
import io.fetch4j.core.RecurrenceSpec;
import io.fetch4j.core.ResultRecord;
import io.fetch4j.core.ResultStore;
import io.fetch4j.core.StoreStatistics;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for jobs and results.
 *
 * <p>Collections:
 * <ul>
 *   <li>{@code fetch_jobs}: one document per recurring job, soft-disabled through {@code status}</li>
 *   <li>{@code fetch_results}: one document per fetched target, append-only</li>
 * </ul>
 */
public class MongoResultStore implements ResultStore {
    private static final Logger log = LoggerFactory.getLogger(MongoResultStore.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoResultStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public String insertResult(ResultRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        ResultRecordDocument doc = toDocument(record);
        mongoTemplate.insert(doc);
        return doc.getId();
    }

    @Override
    public String insertJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        FetchJobDocument doc = toDocument(job);
        mongoTemplate.insert(doc);
        return doc.getId();
    }

    @Override
    public long updateJob(String jobId, JobStatus status, Instant lastRun, Instant nextRun) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(status, "status must not be null");

        Update u = new Update().set("status", status);
        if (lastRun != null) {
            u.set("lastRun", lastRun);
        }
        if (nextRun != null) {
            u.set("nextRun", nextRun);
        }

        Query q = new Query(Criteria.where("_id").is(jobId));
        return mongoTemplate.updateFirst(q, u, FetchJobDocument.class).getModifiedCount();
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        FetchJobDocument doc = mongoTemplate.findById(jobId, FetchJobDocument.class);
        return Optional.ofNullable(doc).map(this::toJob);
    }

    @Override
    public List<Job> listActiveJobs() {
        Query q = new Query(Criteria.where("status").is(JobStatus.ACTIVE));
        q.with(Sort.by(Sort.Order.desc("createdAt")));

        List<FetchJobDocument> docs = mongoTemplate.find(q, FetchJobDocument.class);
        List<Job> jobs = new ArrayList<>(docs.size());
        for (FetchJobDocument doc : docs) {
            jobs.add(toJob(doc));
        }
        return jobs;
    }

    @Override
    public List<ResultRecord> findRecentResults(int limit, int offset) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }

        Query q = new Query();
        q.with(Sort.by(Sort.Order.desc("fetchedAt")));
        q.skip(offset);
        q.limit(limit);

        List<ResultRecordDocument> docs = mongoTemplate.find(q, ResultRecordDocument.class);
        List<ResultRecord> records = new ArrayList<>(docs.size());
        for (ResultRecordDocument doc : docs) {
            records.add(toRecord(doc));
        }
        return records;
    }

    @Override
    public StoreStatistics statistics() {
        long total = mongoTemplate.count(new Query(), ResultRecordDocument.class);
        long activeJobs = mongoTemplate.count(
                new Query(Criteria.where("status").is(JobStatus.ACTIVE)),
                FetchJobDocument.class
        );

        return new StoreStatistics(
                total,
                countBy("status"),
                countBy("strategyUsed"),
                activeJobs
        );
    }

    private Map<String, Long> countBy(String field) {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.group(field).count().as("count")
        );

        Map<String, Long> counts = new LinkedHashMap<>();
        for (Document row : mongoTemplate.aggregate(aggregation, ResultRecordDocument.class, Document.class)) {
            Object key = row.get("_id");
            Object count = row.get("count");
            counts.put(String.valueOf(key), count instanceof Number n ? n.longValue() : 0L);
        }
        return counts;
    }

    ResultRecordDocument toDocument(ResultRecord record) {
        ResultRecordDocument doc = new ResultRecordDocument();
        doc.setTarget(record.target());
        doc.setTitle(record.title());
        doc.setBody(record.body());
        doc.setStrategyUsed(record.strategyUsed());
        doc.setStatus(record.statusText());
        doc.setFetchedAt(record.fetchedAt());

        if (!record.metadata().isEmpty()) {
            // plain JSON values only: strings, numbers, lists, nested maps
            Map<String, Object> plain = objectMapper.convertValue(record.metadata(), new TypeReference<>() {
            });
            doc.setMetadata(MetadataKeys.escape(plain));
        }
        return doc;
    }

    private FetchJobDocument toDocument(Job job) {
        FetchJobDocument doc = new FetchJobDocument();
        doc.setTarget(job.target());
        doc.setRecurrence(job.recurrence().expression());
        doc.setStrategy(job.strategy());
        doc.setStatus(job.status());
        doc.setCreatedAt(job.createdAt());
        doc.setLastRun(job.lastRun());
        doc.setNextRun(job.nextRun());
        return doc;
    }

    ResultRecord toRecord(ResultRecordDocument doc) {
        return new ResultRecord(
                doc.getId(),
                doc.getTarget(),
                doc.getTitle(),
                doc.getBody(),
                MetadataKeys.unescape(doc.getMetadata()),
                doc.getStrategyUsed(),
                doc.getStatus(),
                doc.getFetchedAt()
        );
    }

    Job toJob(FetchJobDocument doc) {
        return new Job(
                doc.getId(),
                doc.getTarget(),
                recurrenceOf(doc),
                doc.getStrategy(),
                doc.getStatus() == null ? JobStatus.INACTIVE : doc.getStatus(),
                doc.getCreatedAt(),
                doc.getLastRun(),
                doc.getNextRun()
        );
    }

    private static RecurrenceSpec recurrenceOf(FetchJobDocument doc) {
        try {
            return RecurrenceSpec.parse(doc.getRecurrence());
        } catch (InvalidScheduleException e) {
            log.warn("Stored recurrence is invalid, using hourly id={} msg={}", doc.getId(), e.getMessage());
            return RecurrenceSpec.hourly();
        }
    }
}
