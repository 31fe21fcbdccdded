package dk.trustworks.skillgap.team.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.skillgap.team.model.enums.RecommendedSolution;
import dk.trustworks.skillgap.team.model.enums.TeamGapSeverity;
import lombok.Builder;

import java.util.List;

/**
 * A skill gap shared by a large enough share of the team.
 *
 * @param skillName                Canonical skill name.
 * @param category                 Skill category.
 * @param membersNeeding           Members with a gap in the skill.
 * @param percentageNeeding        {@code membersNeeding} as a rounded percentage of the whole team.
 * @param severity                 Team-level severity.
 * @param averageTimeToCompetency  Mean months to competency over the members needing the skill.
 * @param maxTimeToCompetency      Months until the slowest member needing the skill is competent.
 * @param estimatedTrainingCost    Cost of training every member needing the skill.
 * @param estimatedHiringCost      One-time cost of hiring for the skill.
 * @param recommendedSolution      Training, hiring or both.
 * @param memberIds                Ids of the members needing the skill.
 */
@Builder
public record TeamGap(
        @JsonProperty("skill_name") String skillName,
        @JsonProperty("category") String category,
        @JsonProperty("members_needing") int membersNeeding,
        @JsonProperty("percentage_needing") int percentageNeeding,
        @JsonProperty("severity") TeamGapSeverity severity,
        @JsonProperty("average_time_to_competency") double averageTimeToCompetency,
        @JsonProperty("max_time_to_competency") int maxTimeToCompetency,
        @JsonProperty("estimated_training_cost") double estimatedTrainingCost,
        @JsonProperty("estimated_hiring_cost") double estimatedHiringCost,
        @JsonProperty("recommended_solution") RecommendedSolution recommendedSolution,
        @JsonProperty("member_ids") List<String> memberIds
) {

    public TeamGap {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }
}
