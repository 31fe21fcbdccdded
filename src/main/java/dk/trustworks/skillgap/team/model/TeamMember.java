package dk.trustworks.skillgap.team.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.skillgap.gapanalysis.model.UserSkill;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A member of the team being analyzed.
 *
 * <p>Skill records are validated with the team, under paths like {@code members[1].skills[0].yearsExperience}.
 *
 * @param id         Unique id within the team, kept on every derived team entity.
 * @param name       Display name.
 * @param role       Current role on the team.
 * @param department Department.
 * @param skills     Declared skills.
 * @param salary     Annual salary, only used for the hiring cost band.
 * @param hourlyRate Hourly rate, added to the training cost per hour spent learning.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TeamMember(
        @NotBlank(message = "Member id is required")
        String id,
        String name,
        String role,
        String department,
        List<UserSkill> skills,
        @PositiveOrZero(message = "Salary cannot be negative")
        Double salary,
        @JsonProperty("hourly_rate")
        @PositiveOrZero(message = "Hourly rate cannot be negative")
        Double hourlyRate
) {

    public TeamMember {
        // List.copyOf rejects null elements; those must reach validation
        skills = skills == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(skills));
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
