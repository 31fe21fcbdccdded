package dk.trustworks.skillgap.team.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.skillgap.gapanalysis.model.enums.SkillLevel;
import dk.trustworks.skillgap.team.model.enums.Coverage;
import lombok.Builder;

import java.util.List;

@Builder
public record TeamStrength(
        @JsonProperty("skill_name") String skillName,
        @JsonProperty("members_having") int membersHaving,
        @JsonProperty("percentage_having") int percentageHaving,
        @JsonProperty("coverage") Coverage coverage,
        @JsonProperty("expertise_level") SkillLevel expertiseLevel,
        @JsonProperty("member_ids") List<String> memberIds
) {

    public TeamStrength {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }
}
