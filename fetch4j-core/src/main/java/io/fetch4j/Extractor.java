package io.fetch4j;

import io.fetch4j.core.ExtractionResult;
import io.fetch4j.core.FetchException;
import io.fetch4j.core.FetchStrategy;

/**
 * One fetch strategy. Implementations know nothing about scheduling or retries.
 */
public interface Extractor {

    FetchStrategy strategy();

    /**
     * Fetch and normalize a target.
     *
     * @throws FetchException            on transport, parse or render failure (retryable)
     * @throws IllegalArgumentException  if the target cannot be fetched by this strategy at all (terminal)
     */
    ExtractionResult fetch(String target) throws FetchException;
}
