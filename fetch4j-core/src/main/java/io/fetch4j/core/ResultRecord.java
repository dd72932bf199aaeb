package io.fetch4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted outcome of one fetch of one target, success or failure. Append-only.
 *
 * <p>{@code id} is null until the record has been inserted.
 */
public record ResultRecord(
        String id,
        String target,
        String title,
        String body,
        Map<String, Object> metadata,
        FetchStrategy strategyUsed,
        String statusText,
        Instant fetchedAt
) {

    public static final String STATUS_SUCCESS = ExtractionResult.STATUS_SUCCESS;
    public static final String ERROR_PREFIX = "error: ";

    public ResultRecord {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(statusText, "statusText must not be null");
        Objects.requireNonNull(fetchedAt, "fetchedAt must not be null");
        title = title == null ? "" : title;
        body = body == null ? "" : body;
        metadata = (metadata == null || metadata.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ResultRecord of(ExtractionResult result, Instant fetchedAt) {
        return new ResultRecord(
                null,
                result.target(),
                result.title(),
                result.body(),
                result.metadata(),
                result.strategyUsed(),
                result.status(),
                fetchedAt
        );
    }

    public static ResultRecord failure(String target, FetchStrategy strategy, Throwable cause, Instant fetchedAt) {
        return new ResultRecord(null, target, "", "", Map.of(), strategy, errorText(cause), fetchedAt);
    }

    /**
     * "error: &lt;cause&gt;" using the message of the cause, or its type when there is no message.
     */
    public static String errorText(Throwable cause) {
        if (cause == null) {
            return ERROR_PREFIX + "unknown";
        }
        String message = cause.getMessage();
        return ERROR_PREFIX + (message == null || message.isBlank() ? cause.getClass().getSimpleName() : message);
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(statusText);
    }

    public ResultRecord withId(String id) {
        return new ResultRecord(id, target, title, body, metadata, strategyUsed, statusText, fetchedAt);
    }
}
