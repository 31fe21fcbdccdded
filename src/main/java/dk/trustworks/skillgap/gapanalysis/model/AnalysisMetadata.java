package dk.trustworks.skillgap.gapanalysis.model;

import lombok.Builder;

import java.util.List;

@Builder
public record AnalysisMetadata(
        int totalSkillsAnalyzed,
        int gapsIdentified,
        int strengthsIdentified,
        double analysisConfidence,
        long processingTimeMs,
        List<String> notes
) {

    public AnalysisMetadata {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
