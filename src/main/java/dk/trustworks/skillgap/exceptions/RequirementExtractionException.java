package dk.trustworks.skillgap.exceptions;

/**
 * Thrown when the external requirement extractor fails for a project description.
 */
public class RequirementExtractionException extends RuntimeException {

    public RequirementExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
