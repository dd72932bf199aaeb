package io.fetch4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry behaviour as data.
 *
 * <ul>
 *   <li>maxRetries: retries allowed after the first attempt (0 disables retrying)</li>
 *   <li>baseDelay: delay before the first retry; doubles on every further retry</li>
 *   <li>classifier: separates retryable from terminal failures</li>
 * </ul>
 */
public record RetryPolicy(
        int maxRetries,
        Duration baseDelay,
        FailureClassifier classifier
) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(60);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        if (baseDelay.isZero() || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be a positive duration");
        }
        Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, FailureClassifier.defaults());
    }

    public static RetryPolicy of(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, FailureClassifier.defaults());
    }

    /**
     * Delay before the next attempt: {@code baseDelay * 2^attemptCount}.
     *
     * @param attemptCount retries already made (0 before the first retry)
     */
    public Duration delayFor(int attemptCount) {
        int exp = Math.max(0, Math.min(attemptCount, 20)); // avoid overflow
        return baseDelay.multipliedBy(1L << exp);
    }

    public boolean isRetryable(Throwable error) {
        return classifier.classify(error) == FailureClassifier.Kind.RETRYABLE;
    }

    /**
     * True when the failure is retryable and the budget allows another attempt.
     */
    public boolean shouldRetry(int attemptCount, Throwable error) {
        return attemptCount < maxRetries && isRetryable(error);
    }
}
