package io.fetch4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized output of one successful fetch, identical in shape for every {@link FetchStrategy}.
 *
 * <p>Metadata keeps insertion order. Values are strings, numbers or lists of strings.
 */
public record ExtractionResult(
        String target,
        String title,
        String body,
        Map<String, Object> metadata,
        FetchStrategy strategyUsed,
        String status
) {

    public static final String STATUS_SUCCESS = "success";

    public ExtractionResult {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(strategyUsed, "strategyUsed must not be null");
        title = title == null ? "" : title;
        body = body == null ? "" : body;
        metadata = (metadata == null || metadata.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        status = status == null ? STATUS_SUCCESS : status;
    }

    public static ExtractionResult success(String target, String title, String body,
                                           Map<String, Object> metadata, FetchStrategy strategyUsed) {
        return new ExtractionResult(target, title, body, metadata, strategyUsed, STATUS_SUCCESS);
    }

    /**
     * Copy with one extra metadata entry appended.
     */
    public ExtractionResult withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new ExtractionResult(target, title, body, copy, strategyUsed, status);
    }
}
