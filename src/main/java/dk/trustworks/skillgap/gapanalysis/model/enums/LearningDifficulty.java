package dk.trustworks.skillgap.gapanalysis.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LearningDifficulty {
    EASY("easy"),
    MODERATE("moderate"),
    HARD("hard");

    private final String value;

    LearningDifficulty(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static LearningDifficulty forLevelGap(int levelGap) {
        if (levelGap <= 1) {
            return EASY;
        }
        return levelGap == 2 ? MODERATE : HARD;
    }
}
