package dk.trustworks.skillgap.team.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendedApproach {
    TRAINING_FOCUSED("training_focused"),
    HIRING_FOCUSED("hiring_focused"),
    MIXED_APPROACH("mixed_approach");

    private final String value;

    RecommendedApproach(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
