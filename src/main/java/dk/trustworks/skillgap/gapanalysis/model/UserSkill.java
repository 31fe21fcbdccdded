package dk.trustworks.skillgap.gapanalysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import dk.trustworks.skillgap.gapanalysis.model.enums.SkillLevel;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

import java.util.List;

/**
 * A skill as declared by a person. Owned by the caller and never modified.
 *
 * @param skillName       Raw skill name, resolved through the skill catalog before comparison.
 * @param skillCategory   Category as declared; may be blank, the catalog category is used then.
 * @param level           Declared proficiency.
 * @param yearsExperience Years of hands-on experience, absent means unknown.
 * @param confidenceScore Self-reported certainty between 0 and 1, absent means 0.5.
 * @param certifications  Certifications backing the skill.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserSkill(
        @NotBlank(message = "Skill name is required")
        String skillName,
        String skillCategory,
        @NotNull(message = "Skill level is required")
        SkillLevel level,
        @PositiveOrZero(message = "Years of experience cannot be negative")
        Double yearsExperience,
        @DecimalMin(value = "0.0", message = "Confidence score must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "Confidence score must be between 0 and 1")
        Double confidenceScore,
        List<String> certifications
) {

    public static final double DEFAULT_CONFIDENCE = 0.5;

    public UserSkill {
        certifications = certifications == null ? List.of() : List.copyOf(certifications);
    }

    public double years() {
        return yearsExperience == null ? 0.0 : yearsExperience;
    }

    public double effectiveConfidence() {
        return confidenceScore == null ? DEFAULT_CONFIDENCE : confidenceScore;
    }
}
