package dk.trustworks.skillgap.gapanalysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import dk.trustworks.skillgap.gapanalysis.model.enums.GapSeverity;
import dk.trustworks.skillgap.gapanalysis.model.enums.Importance;
import dk.trustworks.skillgap.gapanalysis.model.enums.LearningDifficulty;
import dk.trustworks.skillgap.gapanalysis.model.enums.SkillLevel;
import lombok.Builder;

/**
 * A requirement the person does not meet at the minimum level.
 * {@code currentLevel} is absent when the skill is missing entirely.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkillGap(
        String skillName,
        String category,
        SkillLevel currentLevel,
        SkillLevel requiredLevel,
        int levelGap,
        Double experienceGap,
        GapSeverity gapSeverity,
        LearningDifficulty learningDifficulty,
        int timeToCompetency,
        int priority,
        Importance importance,
        double confidence
) {

    @JsonIgnore
    public boolean isMissing() {
        return currentLevel == null;
    }
}
