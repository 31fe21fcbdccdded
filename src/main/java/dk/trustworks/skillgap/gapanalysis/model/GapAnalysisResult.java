package dk.trustworks.skillgap.gapanalysis.model;

import lombok.Builder;

import java.util.List;

/**
 * Outcome of one person's gap analysis. Built once per request and never mutated;
 * {@code criticalGaps}, {@code quickWins} and {@code longTermGoals} are subsets of {@code skillGaps}.
 */
@Builder
public record GapAnalysisResult(
        int overallMatchPercentage,
        List<SkillGap> skillGaps,
        List<SkillStrength> strengths,
        List<SkillGap> criticalGaps,
        List<SkillGap> quickWins,
        List<SkillGap> longTermGoals,
        List<TransferableSkill> transferableOpportunities,
        Recommendations recommendations,
        AnalysisMetadata metadata
) {

    public GapAnalysisResult {
        skillGaps = skillGaps == null ? List.of() : List.copyOf(skillGaps);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        criticalGaps = criticalGaps == null ? List.of() : List.copyOf(criticalGaps);
        quickWins = quickWins == null ? List.of() : List.copyOf(quickWins);
        longTermGoals = longTermGoals == null ? List.of() : List.copyOf(longTermGoals);
        transferableOpportunities = transferableOpportunities == null ? List.of() : List.copyOf(transferableOpportunities);
        recommendations = recommendations == null ? Recommendations.empty() : recommendations;
    }

    /**
     * Placeholder for a member whose analysis could not be completed.
     */
    public static GapAnalysisResult degraded(String reason) {
        return GapAnalysisResult.builder()
                .overallMatchPercentage(0)
                .metadata(AnalysisMetadata.builder()
                        .analysisConfidence(0.0)
                        .notes(List.of("Analysis failed: " + reason))
                        .build())
                .build();
    }
}
