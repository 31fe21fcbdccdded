package dk.trustworks.skillgap.gapanalysis.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GapSeverity {
    MINOR("minor", 1),
    MODERATE("moderate", 2),
    CRITICAL("critical", 4);

    private final String value;
    private final int priorityWeight;

    GapSeverity(String value, int priorityWeight) {
        this.value = value;
        this.priorityWeight = priorityWeight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int priorityWeight() {
        return priorityWeight;
    }
}
