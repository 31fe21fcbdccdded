package dk.trustworks.skillgap.team.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the shared requirement list of a team analysis came from.
 */
public enum RequirementSource {
    STRUCTURED("structured"),
    REQUIRED_SKILLS("required_skills"),
    EXTRACTED("extracted"),
    NONE("none");

    private final String value;

    RequirementSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
