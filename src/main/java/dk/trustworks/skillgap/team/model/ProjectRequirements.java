package dk.trustworks.skillgap.team.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.skillgap.gapanalysis.model.SkillRequirement;
import dk.trustworks.skillgap.team.model.enums.ProjectPriority;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

import java.util.List;

/**
 * What a project needs from the team.
 *
 * @param name              Project name.
 * @param description       Free text, handed to the requirement extractor when no skills are listed.
 * @param requiredSkills    Plain skill names; each becomes an important, intermediate-level requirement.
 * @param skillRequirements Structured requirements; take precedence over {@code requiredSkills}.
 * @param timeline          Free-text timeline, echoed back.
 * @param priority          Project priority, medium when absent.
 * @param budget            Available budget, echoed back.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectRequirements(
        @NotBlank(message = "Project name is required")
        String name,
        String description,
        @JsonProperty("required_skills")
        List<@NotBlank(message = "Required skill name must not be blank") String> requiredSkills,
        @Valid
        @JsonProperty("skill_requirements")
        List<SkillRequirement> skillRequirements,
        String timeline,
        ProjectPriority priority,
        @PositiveOrZero(message = "Budget cannot be negative")
        Double budget
) {

    public ProjectRequirements {
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        skillRequirements = skillRequirements == null ? List.of() : List.copyOf(skillRequirements);
        priority = priority == null ? ProjectPriority.MEDIUM : priority;
    }
}
