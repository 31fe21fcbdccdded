package dk.trustworks.skillgap.exceptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Thrown when analysis input is empty or malformed and cannot be reconciled,
 * e.g. a negative number of years of experience or a blank skill name.
 * Carries every violation found so callers can report them together.
 */
public class InvalidInputException extends RuntimeException {

    private final List<Violation> violations = new ArrayList<>();

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(List<Violation> violations) {
        super(buildMessage(violations));
        this.violations.addAll(violations);
    }

    public List<Violation> getViolations() {
        return new ArrayList<>(violations);
    }

    private static String buildMessage(List<Violation> violations) {
        if (violations.isEmpty()) {
            return "Invalid analysis input";
        }

        StringBuilder message = new StringBuilder("Invalid analysis input with ")
                .append(violations.size())
                .append(" violation(s):\n");

        for (Violation violation : violations) {
            message.append("- ").append(violation).append("\n");
        }

        return message.toString();
    }

    /**
     * A single rejected field.
     *
     * @param field   Property path, e.g. {@code members[2].skills[0].yearsExperience}.
     * @param message What is wrong with it.
     */
    public record Violation(String field, String message) {

        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
