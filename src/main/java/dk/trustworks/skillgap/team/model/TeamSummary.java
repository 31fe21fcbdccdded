package dk.trustworks.skillgap.team.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder
public record TeamSummary(
        @JsonProperty("total_members") int totalMembers,
        @JsonProperty("analyzed_members") int analyzedMembers,
        @JsonProperty("overall_match") int overallMatch,
        @JsonProperty("critical_gaps_count") int criticalGapsCount,
        @JsonProperty("team_strengths_count") int teamStrengthsCount,
        @JsonProperty("skill_coverage_percentage") int skillCoveragePercentage
) {
}
