package io.fetch4j.core;

/**
 * Transport, parse or render failure while fetching a target.
 *
 * <p>The default {@link FailureClassifier} treats this as retryable.
 */
public class FetchException extends Exception {

    private final String target;

    public FetchException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public FetchException(String target, String message) {
        this(target, message, null);
    }

    public String target() {
        return target;
    }
}
