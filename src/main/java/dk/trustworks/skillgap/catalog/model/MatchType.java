package dk.trustworks.skillgap.catalog.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchType {
    EXACT("exact"),
    SYNONYM("synonym"),
    FUZZY("fuzzy"),
    /** Not in the catalog; the normalized name became its own canonical skill. */
    UNKNOWN("unknown");

    private final String value;

    MatchType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
