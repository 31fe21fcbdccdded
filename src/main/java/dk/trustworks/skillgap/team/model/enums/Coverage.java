package dk.trustworks.skillgap.team.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Coverage {
    GOOD("good"),
    EXCELLENT("excellent");

    private final String value;

    Coverage(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
