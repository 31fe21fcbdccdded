package dk.trustworks.skillgap.team.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MemberStatus {
    ANALYZED("analyzed"),
    FAILED("failed");

    private final String value;

    MemberStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
