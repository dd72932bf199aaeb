package io.fetch4j.core;

/**
 * A retryable failure kept failing until the retry budget ran out.
 *
 * <p>Recorded as a failed {@link ResultRecord}; never thrown to callers of the scheduler.
 */
public class ExhaustedRetriesException extends RuntimeException {

    private final String target;
    private final int attempts;

    public ExhaustedRetriesException(String target, int attempts, Throwable lastFailure) {
        super("gave up on " + target + " after " + attempts + " attempts", lastFailure);
        this.target = target;
        this.attempts = attempts;
    }

    public String target() {
        return target;
    }

    public int attempts() {
        return attempts;
    }
}
