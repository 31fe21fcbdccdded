package dk.trustworks.skillgap.gapanalysis.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * How much a requirement matters to the job or project.
 */
public enum Importance {
    CRITICAL("critical", 3, 5),
    IMPORTANT("important", 2, 3),
    NICE_TO_HAVE("nice-to-have", 1, 1);

    private final String value;
    private final int matchWeight;
    private final int priorityWeight;

    Importance(String value, int matchWeight, int priorityWeight) {
        this.value = value;
        this.matchWeight = matchWeight;
        this.priorityWeight = priorityWeight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Weight of a requirement in the overall match percentage.
     */
    public int matchWeight() {
        return matchWeight;
    }

    /**
     * Contribution of the importance to a gap's 1-10 priority.
     */
    public int priorityWeight() {
        return priorityWeight;
    }

    @JsonCreator
    public static Importance fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace('_', '-');
        return Arrays.stream(values())
                .filter(importance -> importance.value.equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown importance: " + value));
    }
}
