package io.fetch4j.core;

/**
 * A fetch strategy could not acquire the resources it runs on (e.g. no browser available).
 */
public class StrategyInitException extends Exception {

    public StrategyInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
