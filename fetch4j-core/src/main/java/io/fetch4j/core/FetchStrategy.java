package io.fetch4j.core;

import java.util.Locale;

/**
 * The closed set of interchangeable fetch strategies.
 */
public enum FetchStrategy {
    /**
     * Plain HTTP GET followed by HTML parsing.
     */
    STATIC,
    /**
     * Headless browser that renders the page before it is read.
     */
    SCRIPTED;

    /**
     * Maps the legacy "use browser" flag to a strategy.
     */
    public static FetchStrategy fromFlag(boolean useBrowser) {
        return useBrowser ? SCRIPTED : STATIC;
    }

    /**
     * Case-insensitive lookup, e.g. "static" or "SCRIPTED".
     */
    public static FetchStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("strategy must not be blank");
        }
        try {
            return FetchStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported fetch strategy: " + value);
        }
    }
}
