package dk.trustworks.skillgap.exceptions;

/**
 * Thrown when merging per-member results into a team result fails.
 * Indicates a defect rather than bad input, so it is never downgraded.
 */
public class AggregationException extends RuntimeException {

    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
