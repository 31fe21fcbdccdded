package dk.trustworks.skillgap.team.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.skillgap.team.model.enums.RequirementSource;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder
public record TeamAnalysisMetadata(
        @JsonProperty("team_size") int teamSize,
        @JsonProperty("processing_time") long processingTimeMs,
        @JsonProperty("analysis_confidence") double analysisConfidence,
        @JsonProperty("analysis_timestamp") Instant analysisTimestamp,
        @JsonProperty("project_skills_analyzed") int projectSkillsAnalyzed,
        @JsonProperty("requirements_source") RequirementSource requirementsSource,
        @JsonProperty("failed_members") List<String> failedMembers
) {

    public TeamAnalysisMetadata {
        failedMembers = failedMembers == null ? List.of() : List.copyOf(failedMembers);
    }
}
