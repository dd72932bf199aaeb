package io.fetch4j.core;

/**
 * Decides whether a failed fetch may be retried.
 */
@FunctionalInterface
public interface FailureClassifier {

    enum Kind {
        RETRYABLE,
        TERMINAL
    }

    Kind classify(Throwable error);

    /**
     * {@link FetchException} anywhere in the cause chain is retryable (network, timeout, parse, render);
     * everything else (malformed target, unsupported strategy, programming errors) is terminal.
     */
    static FailureClassifier defaults() {
        return error -> {
            Throwable t = error;
            int depth = 0;
            while (t != null && depth++ < 16) {
                if (t instanceof FetchException) {
                    return Kind.RETRYABLE;
                }
                t = t.getCause();
            }
            return Kind.TERMINAL;
        };
    }
}
