package dk.trustworks.skillgap.gapanalysis.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Ordered proficiency levels. The rank is used for all gap arithmetic;
 * a skill the person does not have at all counts as rank 0.
 */
public enum SkillLevel {
    BEGINNER("beginner", 1),
    INTERMEDIATE("intermediate", 2),
    ADVANCED("advanced", 3),
    EXPERT("expert", 4);

    private final String value;
    private final int rank;

    SkillLevel(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public boolean isAbove(SkillLevel other) {
        return rank > other.rank;
    }

    public boolean meets(SkillLevel required) {
        return rank >= required.rank;
    }

    /**
     * Levels the holder of {@code current} must climb to reach this level.
     * A missing skill ({@code null}) counts from zero.
     */
    public int gapFrom(SkillLevel current) {
        int from = current == null ? 0 : current.rank;
        return Math.max(0, rank - from);
    }

    @JsonCreator
    public static SkillLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(level -> level.value.equalsIgnoreCase(value.trim()) || level.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown skill level: " + value));
    }
}
