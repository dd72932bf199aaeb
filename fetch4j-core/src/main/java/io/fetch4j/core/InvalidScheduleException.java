package io.fetch4j.core;

/**
 * Thrown when a recurrence declaration cannot be turned into trigger times.
 */
public class InvalidScheduleException extends IllegalArgumentException {

    private final String expression;

    public InvalidScheduleException(String expression, String message) {
        super(message + ": " + expression);
        this.expression = expression;
    }

    /**
     * The declaration as supplied by the caller.
     */
    public String expression() {
        return expression;
    }
}
