package dk.trustworks.skillgap.team.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TeamGapSeverity {
    MODERATE("moderate"),
    CRITICAL("critical");

    private final String value;

    TeamGapSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
