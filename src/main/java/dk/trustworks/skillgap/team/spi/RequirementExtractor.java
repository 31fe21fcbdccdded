package dk.trustworks.skillgap.team.spi;

import dk.trustworks.skillgap.gapanalysis.model.SkillRequirement;

import java.util.List;

/**
 * Turns a free-text project description into structured requirements.
 *
 * <p>Implementations live outside this library (NLP, LLM or rule based). Provide one as a CDI bean
 * to let team analyses run on projects that only carry a description. Returned requirements may
 * contain duplicate skill names; they are merged by the gap analysis.
 */
public interface RequirementExtractor {

    /**
     * @param description free-text project or job description, never blank
     * @param projectName name of the project the description belongs to
     * @return extracted requirements, possibly empty
     */
    List<SkillRequirement> extract(String description, String projectName);
}
