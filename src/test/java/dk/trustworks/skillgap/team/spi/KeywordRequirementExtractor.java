package dk.trustworks.skillgap.team.spi;

import dk.trustworks.skillgap.gapanalysis.model.SkillRequirement;
import dk.trustworks.skillgap.gapanalysis.model.enums.Importance;
import dk.trustworks.skillgap.gapanalysis.model.enums.SkillLevel;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Test extractor that recognises a few fixed keywords in a project description.
 */
@ApplicationScoped
public class KeywordRequirementExtractor implements RequirementExtractor {

    @Override
    public List<SkillRequirement> extract(String description, String projectName) {
        String text = description.toLowerCase(Locale.ROOT);
        List<SkillRequirement> requirements = new ArrayList<>();
        if (text.contains("kotlin")) {
            requirements.add(requirement("Kotlin", Importance.CRITICAL, SkillLevel.ADVANCED));
        }
        if (text.contains("kubernetes")) {
            requirements.add(requirement("Kubernetes", Importance.IMPORTANT, SkillLevel.INTERMEDIATE));
        }
        return requirements;
    }

    private static SkillRequirement requirement(String skill, Importance importance, SkillLevel level) {
        return SkillRequirement.builder()
                .skill(skill)
                .importance(importance)
                .minimumLevel(level)
                .confidence(0.9)
                .context("keyword match")
                .build();
    }
}
