package dk.trustworks.skillgap.team.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Outcome of a team analysis. {@code memberAnalyses} holds one entry per team member,
 * failed ones included; team gaps and strengths name the members they were derived from.
 */
@Builder
public record TeamAnalysisResult(
        @JsonProperty("analysis_id") String analysisId,
        @JsonProperty("project") ProjectRequirements project,
        @JsonProperty("team_summary") TeamSummary teamSummary,
        @JsonProperty("member_analyses") List<MemberAnalysis> memberAnalyses,
        @JsonProperty("team_gaps") List<TeamGap> teamGaps,
        @JsonProperty("team_strengths") List<TeamStrength> teamStrengths,
        @JsonProperty("recommendations") TeamRecommendations recommendations,
        @JsonProperty("budget_estimates") BudgetEstimate budgetEstimates,
        @JsonProperty("metadata") TeamAnalysisMetadata metadata
) {

    public TeamAnalysisResult {
        memberAnalyses = memberAnalyses == null ? List.of() : List.copyOf(memberAnalyses);
        teamGaps = teamGaps == null ? List.of() : List.copyOf(teamGaps);
        teamStrengths = teamStrengths == null ? List.of() : List.copyOf(teamStrengths);
    }
}
