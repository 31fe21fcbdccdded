package dk.trustworks.skillgap.team.services;

import dk.trustworks.skillgap.catalog.services.SkillCatalog;
import dk.trustworks.skillgap.exceptions.RequirementExtractionException;
import dk.trustworks.skillgap.gapanalysis.model.SkillRequirement;
import dk.trustworks.skillgap.gapanalysis.model.enums.Importance;
import dk.trustworks.skillgap.gapanalysis.model.enums.SkillLevel;
import dk.trustworks.skillgap.team.model.ProjectRequirements;
import dk.trustworks.skillgap.team.model.enums.RequirementSource;
import dk.trustworks.skillgap.team.spi.RequirementExtractor;
import dk.trustworks.skillgap.validation.InputValidator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Resolves the requirement list shared by all members of a team analysis.
 *
 * <p>Precedence: structured {@code skillRequirements}, then plain {@code requiredSkills}
 * (important, intermediate level), then the {@link RequirementExtractor} applied to the
 * description when such a bean is deployed. Without any of these the list is empty.
 */
@JBossLog
@ApplicationScoped
public class ProjectRequirementResolver {

    static final Importance DEFAULT_IMPORTANCE = Importance.IMPORTANT;
    static final SkillLevel DEFAULT_MINIMUM_LEVEL = SkillLevel.INTERMEDIATE;

    private final SkillCatalog catalog;
    private final InputValidator inputValidator;
    private final Instance<RequirementExtractor> extractors;

    @Inject
    public ProjectRequirementResolver(SkillCatalog catalog, InputValidator inputValidator,
                                      Instance<RequirementExtractor> extractors) {
        this.catalog = catalog;
        this.inputValidator = inputValidator;
        this.extractors = extractors;
    }

    /**
     * @throws RequirementExtractionException when the extractor fails or returns malformed requirements
     */
    public ResolvedRequirements resolve(ProjectRequirements project) {
        if (!project.skillRequirements().isEmpty()) {
            return new ResolvedRequirements(project.skillRequirements(), RequirementSource.STRUCTURED);
        }

        if (!project.requiredSkills().isEmpty()) {
            List<SkillRequirement> requirements = project.requiredSkills().stream()
                    .map(this::fromSkillName)
                    .toList();
            return new ResolvedRequirements(requirements, RequirementSource.REQUIRED_SKILLS);
        }

        if (StringUtils.isNotBlank(project.description()) && extractors.isResolvable()) {
            RequirementExtractor extractor = extractors.get();
            try {
                List<SkillRequirement> extracted = extractor.extract(project.description(), project.name());
                if (extracted != null) {
                    inputValidator.validateRequirements(extracted, "extractedRequirements");
                }
                log.infof("[ProjectRequirementResolver] Extracted %d requirement(s) for project '%s'",
                        extracted == null ? 0 : extracted.size(), project.name());
                return new ResolvedRequirements(extracted == null ? List.of() : extracted, RequirementSource.EXTRACTED);
            } catch (RuntimeException e) {
                throw new RequirementExtractionException(
                        "Requirement extraction failed for project '" + project.name() + "'", e);
            }
        }

        log.warnf("[ProjectRequirementResolver] Project '%s' has no requirements; every member will match 100%%", project.name());
        return new ResolvedRequirements(List.of(), RequirementSource.NONE);
    }

    private SkillRequirement fromSkillName(String skillName) {
        return SkillRequirement.builder()
                .skill(skillName.trim())
                .category(catalog.categoryOf(skillName).orElse(null))
                .importance(DEFAULT_IMPORTANCE)
                .minimumLevel(DEFAULT_MINIMUM_LEVEL)
                .confidence(1.0)
                .context("required_skills")
                .build();
    }

    /**
     * @param requirements The shared requirement list, possibly empty.
     * @param source       Where it came from; reported in the team metadata.
     */
    public record ResolvedRequirements(List<SkillRequirement> requirements, RequirementSource source) {

        public ResolvedRequirements {
            requirements = List.copyOf(requirements);
        }
    }
}
