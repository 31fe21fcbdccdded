package dk.trustworks.skillgap.team.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a team gap should be closed.
 */
public enum RecommendedSolution {
    /** Upskill the members who need the skill. */
    TRAINING("training"),
    /** Nobody on the team holds the skill above beginner level. */
    HIRING("hiring"),
    /** Targeted hire plus internal upskilling led by the members who already have the skill. */
    MIXED("mixed");

    private final String value;

    RecommendedSolution(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean includesTraining() {
        return this == TRAINING || this == MIXED;
    }

    public boolean includesHiring() {
        return this == HIRING || this == MIXED;
    }
}
