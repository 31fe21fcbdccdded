package dk.trustworks.skillgap.exceptions;

/**
 * Thrown when the skill catalog cannot be loaded.
 */
public class SkillCatalogException extends RuntimeException {

    public SkillCatalogException(String message) {
        super(message);
    }

    public SkillCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
