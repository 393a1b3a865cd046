package io.citysense.metrics;

/**
 * Raised when numeric input to a metric computation is malformed or degenerate.
 * Never retried: recomputing the same input yields the same failure.
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}
