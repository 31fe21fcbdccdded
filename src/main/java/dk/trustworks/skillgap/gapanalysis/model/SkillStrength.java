package dk.trustworks.skillgap.gapanalysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import dk.trustworks.skillgap.gapanalysis.model.enums.SkillLevel;

/**
 * A skill the person meets or exceeds, or holds at a high level without it being required.
 *
 * @param skillName       Canonical catalog name, used for grouping across team members.
 * @param category        Category of the skill.
 * @param level           The person's actual level.
 * @param yearsExperience The person's years of experience.
 * @param required        True when the skill satisfied a requirement.
 * @param requiredLevel   Minimum level asked for, absent for non-required strengths.
 * @param source          The declared skill this strength was derived from.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkillStrength(
        String skillName,
        String category,
        SkillLevel level,
        double yearsExperience,
        boolean required,
        SkillLevel requiredLevel,
        UserSkill source
) {
}
