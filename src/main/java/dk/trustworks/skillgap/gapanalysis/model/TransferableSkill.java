package dk.trustworks.skillgap.gapanalysis.model;

/**
 * A skill the person already has that partially substitutes for a missing requirement.
 */
public record TransferableSkill(
        UserSkill fromSkill,
        String toSkillName,
        String toCategory,
        double transferabilityScore,
        String reasoning
) {
}
