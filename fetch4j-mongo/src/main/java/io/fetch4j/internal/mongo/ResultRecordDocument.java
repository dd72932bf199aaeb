package io.fetch4j.internal.mongo;

import io.fetch4j.core.FetchStrategy;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for fetch results. Inserted once, never updated.
 */
@Document(collection = "fetch_results")
public class ResultRecordDocument {

    @Id
    private String id;

    private String target;
    private String title;
    private String body;
    private Map<String, Object> metadata;
    private FetchStrategy strategyUsed;
    private String status;
    private Instant fetchedAt;

    public ResultRecordDocument() {
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

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public FetchStrategy getStrategyUsed() {
        return strategyUsed;
    }

    public void setStrategyUsed(FetchStrategy strategyUsed) {
        this.strategyUsed = strategyUsed;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public void setFetchedAt(Instant fetchedAt) {
        this.fetchedAt = fetchedAt;
    }
}
