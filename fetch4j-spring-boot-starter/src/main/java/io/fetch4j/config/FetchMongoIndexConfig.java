package io.fetch4j.config;

import io.fetch4j.internal.mongo.FetchJobDocument;
import io.fetch4j.internal.mongo.ResultRecordDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the fetch collections.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code fetch4j.ensure-indexes-on-startup=true}. In production they are usually managed by migrations or ops
 * scripts.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>idx_status_createdAt</b> on {@code fetch_jobs}: { status: 1, createdAt: -1 }
 *       <br/>Used by active job listing and reload on start.</li>
 *   <li><b>idx_fetchedAt</b> on {@code fetch_results}: { fetchedAt: -1 }
 *       <br/>Used by recent result paging.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.fetch_jobs.createIndex({ status: 1, createdAt: -1 }, { name: "idx_status_createdAt" });
 * db.fetch_results.createIndex({ fetchedAt: -1 }, { name: "idx_fetchedAt" });
 * </pre>
 */
public class FetchMongoIndexConfig {

    public static final String IDX_STATUS_CREATED_AT = "idx_status_createdAt";
    public static final String IDX_FETCHED_AT = "idx_fetchedAt";

    private final MongoTemplate mongoTemplate;

    public FetchMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Ensure the indexes above exist. Not annotated with {@code @PostConstruct}; call it explicitly.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(FetchJobDocument.class).ensureIndex(activeJobsIndex());
        mongoTemplate.indexOps(ResultRecordDocument.class).ensureIndex(recentResultsIndex());
    }

    public static Index activeJobsIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_STATUS_CREATED_AT);
    }

    public static Index recentResultsIndex() {
        return new Index()
                .on("fetchedAt", Sort.Direction.DESC)
                .named(IDX_FETCHED_AT);
    }
}
