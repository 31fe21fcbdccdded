package dk.trustworks.skillgap.gapanalysis.services;

import dk.trustworks.skillgap.gapanalysis.model.GapAnalysisResult;
import dk.trustworks.skillgap.gapanalysis.model.SkillGap;
import dk.trustworks.skillgap.gapanalysis.model.SkillRequirement;
import dk.trustworks.skillgap.gapanalysis.model.SkillStrength;
import dk.trustworks.skillgap.gapanalysis.model.TransferableSkill;
import dk.trustworks.skillgap.gapanalysis.model.UserSkill;
import dk.trustworks.skillgap.gapanalysis.model.enums.GapSeverity;
import dk.trustworks.skillgap.gapanalysis.model.enums.Importance;
import dk.trustworks.skillgap.gapanalysis.model.enums.LearningDifficulty;
import dk.trustworks.skillgap.gapanalysis.model.enums.SkillLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dk.trustworks.skillgap.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GapAnalyzer Unit Tests")
class GapAnalyzerTest {

    private GapAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = gapAnalyzer();
    }

    private static SkillGap gapFor(GapAnalysisResult result, String skillName) {
        return result.skillGaps().stream()
                .filter(gap -> gap.skillName().equals(skillName))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No gap for " + skillName));
    }

    // =========================================================================
    // Edge cases
    // =========================================================================

    @Nested
    @DisplayName("Empty inputs")
    class EmptyInputTests {

        @Test
        @DisplayName("No requirements → 100%, no gaps, every skill a strength")
        void analyze_noRequirements_fullMatch() {
            // Given
            List<UserSkill> userSkills = skills(
                    skill("Java", SkillLevel.BEGINNER),
                    skill("Docker", SkillLevel.EXPERT));

            // When
            GapAnalysisResult result = analyzer.analyze(userSkills, List.of());

            // Then
            assertEquals(100, result.overallMatchPercentage());
            assertTrue(result.skillGaps().isEmpty());
            assertEquals(2, result.strengths().size());
            assertEquals(1.0, result.metadata().analysisConfidence());
        }

        @Test
        @DisplayName("No skills → every requirement is a missing gap")
        void analyze_noSkills_everyRequirementMissing() {
            // Given
            List<SkillRequirement> requirements = requirements(
                    requirement("React", Importance.CRITICAL, SkillLevel.INTERMEDIATE),
                    requirement("Docker", Importance.IMPORTANT, SkillLevel.BEGINNER),
                    requirement("Figma", Importance.NICE_TO_HAVE, SkillLevel.ADVANCED));

            // When
            GapAnalysisResult result = analyzer.analyze(List.of(), requirements);

            // Then
            assertEquals(0, result.overallMatchPercentage());
            assertEquals(3, result.skillGaps().size());
            assertTrue(result.skillGaps().stream().allMatch(SkillGap::isMissing));
            assertEquals(2, gapFor(result, "React").levelGap());
            assertEquals(1, gapFor(result, "Docker").levelGap());
            assertEquals(3, gapFor(result, "Figma").levelGap());
            assertTrue(result.strengths().isEmpty());
        }
    }

    // =========================================================================
    // Matching and scoring
    // =========================================================================

    @Nested
    @DisplayName("Overall match")
    class OverallMatchTests {

        @Test
        @DisplayName("Weighted by importance: critical met, important missing → 60%")
        void analyze_weightsByImportance() {
            GapAnalysisResult result = analyzer.analyze(
                    skills(skill("React", SkillLevel.ADVANCED)),
                    requirements(
                            requirement("React", Importance.CRITICAL, SkillLevel.INTERMEDIATE),
                            requirement("TypeScript", Importance.IMPORTANT, SkillLevel.INTERMEDIATE)));

            assertEquals(60, result.overallMatchPercentage());
            assertEquals(1, result.skillGaps().size());
            assertEquals("TypeScript", result.skillGaps().get(0).skillName());
        }

        @Test
        @DisplayName("Synonym on the CV satisfies the canonical requirement")
        void analyze_synonymSkill_satisfiesRequirement() {
            GapAnalysisResult result = analyzer.analyze(
                    skills(skill("JS", SkillLevel.EXPERT)),
                    requirements(requirement("JavaScript", Importance.CRITICAL, SkillLevel.ADVANCED)));

            assertEquals(100, result.overallMatchPercentage());
            SkillStrength strength = result.strengths().get(0);
            assertEquals("JavaScript", strength.skillName());
            assertTrue(strength.required());
            assertEquals(SkillLevel.ADVANCED, strength.requiredLevel());
            assertEquals("JS", strength.source().skillName());
        }

        @Test
        @DisplayName("Percentage stays within 0..100")
        void analyze_percentageIsBounded() {
            GapAnalysisResult result = analyzer.analyze(
                    skills(skill("Python", SkillLevel.BEGINNER)),
                    requirements(
                            requirement("Python", Importance.NICE_TO_HAVE, SkillLevel.EXPERT),
                            requirement("Rust", Importance.CRITICAL, SkillLevel.EXPERT)));

            assertTrue(result.overallMatchPercentage() >= 0);
            assertTrue(result.overallMatchPercentage() <= 100);
        }

        @Test
        @DisplayName("Identical input twice → identical gaps and percentage")
        void analyze_isIdempotent() {
            List<UserSkill> userSkills = skills(skill("Java", SkillLevel.INTERMEDIATE), skill("AWS", SkillLevel.BEGINNER));
            List<SkillRequirement> requirements = requirements(
                    requirement("Java", Importance.CRITICAL, SkillLevel.EXPERT),
                    requirement("Kubernetes", Importance.IMPORTANT, SkillLevel.INTERMEDIATE));

            GapAnalysisResult first = analyzer.analyze(userSkills, requirements);
            GapAnalysisResult second = analyzer.analyze(userSkills, requirements);

            assertEquals(first.skillGaps(), second.skillGaps());
            assertEquals(first.overallMatchPercentage(), second.overallMatchPercentage());
            assertEquals(first.recommendations(), second.recommendations());
        }
    }

    @Nested
    @DisplayName("Gap scoring")
    class GapScoringTests {

        @Test
        @DisplayName("Severity follows importance, level gap and whether the skill is missing")
        void severity_table() {
            assertEquals(GapSeverity.CRITICAL, GapAnalyzer.severity(Importance.CRITICAL, 2, false));
            assertEquals(GapSeverity.CRITICAL, GapAnalyzer.severity(Importance.CRITICAL, 1, true));
            assertEquals(GapSeverity.MODERATE, GapAnalyzer.severity(Importance.CRITICAL, 1, false));
            assertEquals(GapSeverity.MODERATE, GapAnalyzer.severity(Importance.IMPORTANT, 1, true));
            assertEquals(GapSeverity.MODERATE, GapAnalyzer.severity(Importance.IMPORTANT, 3, false));
            assertEquals(GapSeverity.MINOR, GapAnalyzer.severity(Importance.NICE_TO_HAVE, 1, false));
            assertEquals(GapSeverity.MINOR, GapAnalyzer.severity(Importance.NICE_TO_HAVE, 4, true));
        }

        @Test
        @DisplayName("Priority adds importance, severity and confidence, capped to 1..10")
        void priority_isWeightedAndCapped() {
            assertEquals(10, GapAnalyzer.priority(Importance.CRITICAL, GapSeverity.CRITICAL, 1.0));
            assertEquals(6, GapAnalyzer.priority(Importance.IMPORTANT, GapSeverity.MODERATE, 0.5));
            assertEquals(2, GapAnalyzer.priority(Importance.NICE_TO_HAVE, GapSeverity.MINOR, 0.0));
            assertEquals(10, GapAnalyzer.priority(Importance.CRITICAL, GapSeverity.CRITICAL, 7.0));
        }

        @Test
        @DisplayName("Slow-learning categories take 1.5x longer")
        void timeToCompetency_slowCategoriesTakeLonger() {
            assertEquals(4, analyzer.timeToCompetency(2, "Programming"));
            assertEquals(3, analyzer.timeToCompetency(1, "Cloud & DevOps"));
            assertEquals(9, analyzer.timeToCompetency(3, "ai & machine learning"));
            assertEquals(2, analyzer.timeToCompetency(1, null));
        }

        @Test
        @DisplayName("Partial skill → gap with current level, difficulty and experience gap")
        void analyze_partialSkill_scoresGap() {
            SkillRequirement kubernetes = requirement("Kubernetes", Importance.CRITICAL, SkillLevel.EXPERT)
                    .toBuilder()
                    .yearsRequired(5.0)
                    .build();

            GapAnalysisResult result = analyzer.analyze(
                    skills(skill("K8s", SkillLevel.INTERMEDIATE, 2.0)),
                    requirements(kubernetes));

            SkillGap gap = gapFor(result, "Kubernetes");
            assertEquals(SkillLevel.INTERMEDIATE, gap.currentLevel());
            assertEquals(SkillLevel.EXPERT, gap.requiredLevel());
            assertEquals(2, gap.levelGap());
            assertEquals(GapSeverity.CRITICAL, gap.gapSeverity());
            assertEquals(LearningDifficulty.MODERATE, gap.learningDifficulty());
            assertEquals(6, gap.timeToCompetency());
            assertEquals(3.0, gap.experienceGap());
            assertEquals("Cloud & DevOps", gap.category());
            assertEquals(0.95, gap.confidence(), 0.001);
            assertEquals(List.of(gap), result.criticalGaps());
        }

        @Test
        @DisplayName("Unknown requirement → General category and lowered confidence")
        void analyze_unknownRequirement_usesGeneralCategory() {
            GapAnalysisResult result = analyzer.analyze(
                    List.of(),
                    requirements(requirement("Underwater Basket Weaving", Importance.IMPORTANT, SkillLevel.BEGINNER)));

            SkillGap gap = result.skillGaps().get(0);
            assertEquals("underwater basket weaving", gap.skillName());
            assertEquals("General", gap.category());
            assertEquals(0.5, gap.confidence());
            assertEquals(0.5, result.metadata().analysisConfidence());
        }

        @Test
        @DisplayName("Gaps are ordered by priority, highest first")
        void analyze_gapsOrderedByPriority() {
            GapAnalysisResult result = analyzer.analyze(
                    List.of(),
                    requirements(
                            requirement("Figma", Importance.NICE_TO_HAVE, SkillLevel.BEGINNER),
                            requirement("Docker", Importance.IMPORTANT, SkillLevel.INTERMEDIATE),
                            requirement("Java", Importance.CRITICAL, SkillLevel.ADVANCED)));

            assertEquals(List.of("Java", "Docker", "Figma"),
                    result.skillGaps().stream().map(SkillGap::skillName).toList());
        }
    }

    // =========================================================================
    // Duplicates
    // =========================================================================

    @Nested
    @DisplayName("Duplicate handling")
    class DuplicateTests {

        @Test
        @DisplayName("Duplicate requirements merge by max importance and max level")
        void analyze_duplicateRequirements_mergeByMax() {
            GapAnalysisResult result = analyzer.analyze(
                    skills(skill("React", SkillLevel.INTERMEDIATE)),
                    requirements(
                            requirement("React", Importance.NICE_TO_HAVE, SkillLevel.BEGINNER),
                            requirement("ReactJS", Importance.CRITICAL, SkillLevel.ADVANCED)));

            assertEquals(1, result.metadata().totalSkillsAnalyzed());
            SkillGap gap = gapFor(result, "React");
            assertEquals(Importance.CRITICAL, gap.importance());
            assertEquals(SkillLevel.ADVANCED, gap.requiredLevel());
            assertEquals(1, gap.levelGap());
            assertEquals(GapSeverity.MODERATE, gap.gapSeverity());
            assertTrue(result.metadata().notes().contains("Merged 1 duplicate requirement(s)"));
        }

        @Test
        @DisplayName("Duplicate requirements without years → merged, no experience gap")
        void analyze_duplicateRequirementsWithoutYears_merge() {
            GapAnalysisResult result = analyzer.analyze(
                    skills(skill("Java", SkillLevel.BEGINNER)),
                    requirements(
                            requirement("Java", Importance.IMPORTANT, SkillLevel.INTERMEDIATE),
                            requirement("java", Importance.IMPORTANT, SkillLevel.INTERMEDIATE)));

            assertEquals(1, result.skillGaps().size());
            assertNull(gapFor(result, "Java").experienceGap());
        }

        @Test
        @DisplayName("Years required on one duplicate only → kept after the merge")
        void analyze_duplicateRequirementsOneWithYears_keepsYears() {
            SkillRequirement withYears = requirement("Java", Importance.IMPORTANT, SkillLevel.ADVANCED)
                    .toBuilder()
                    .yearsRequired(5.0)
                    .build();

            GapAnalysisResult result = analyzer.analyze(
                    skills(skill("Java", SkillLevel.INTERMEDIATE)),
                    requirements(requirement("Java", Importance.IMPORTANT, SkillLevel.ADVANCED), withYears));

            assertEquals(3.0, gapFor(result, "Java").experienceGap());
        }

        @Test
        @DisplayName("Duplicate skill declarations keep the highest level")
        void analyze_duplicateSkills_highestLevelWins() {
            GapAnalysisResult result = analyzer.analyze(
                    skills(skill("Python", SkillLevel.BEGINNER), skill("python3", SkillLevel.ADVANCED)),
                    requirements(requirement("Python", Importance.CRITICAL, SkillLevel.ADVANCED)));

            assertEquals(100, result.overallMatchPercentage());
            assertEquals(SkillLevel.ADVANCED, result.strengths().get(0).level());
        }
    }

    // =========================================================================
    // Strengths, transferable skills and recommendations
    // =========================================================================

    @Nested
    @DisplayName("Strengths and opportunities")
    class StrengthTests {

        @Test
        @DisplayName("Unrequired advanced skills are strengths, unrequired beginner skills are not")
        void analyze_unrequiredStrengths_onlyAdvancedOrExpert() {
            GapAnalysisResult result = analyzer.analyze(
                    skills(
                            skill("Java", SkillLevel.ADVANCED),
                            skill("Go", SkillLevel.EXPERT),
                            skill("PHP", SkillLevel.BEGINNER)),
                    requirements(requirement("Java", Importance.IMPORTANT, SkillLevel.INTERMEDIATE)));

            List<String> names = result.strengths().stream().map(SkillStrength::skillName).toList();
            assertEquals(List.of("Java", "Go"), names);
            assertTrue(result.strengths().get(0).required());
            assertFalse(result.strengths().get(1).required());
        }

        @Test
        @DisplayName("Same-category skill with experience is a transferable opportunity")
        void analyze_sameCategorySkill_isTransferable() {
            GapAnalysisResult result = analyzer.analyze(
                    skills(
                            skill("JavaScript", SkillLevel.EXPERT, 3.0),
                            skill("Communication", SkillLevel.EXPERT, 10.0)),
                    requirements(requirement("TypeScript", Importance.IMPORTANT, SkillLevel.INTERMEDIATE)));

            List<TransferableSkill> opportunities = result.transferableOpportunities();
            assertEquals(1, opportunities.size());
            TransferableSkill best = opportunities.get(0);
            assertEquals("JavaScript", best.fromSkill().skillName());
            assertEquals("TypeScript", best.toSkillName());
            assertEquals(0.8, best.transferabilityScore(), 0.001);
            assertTrue(best.reasoning().contains("same category"));
            assertTrue(result.recommendations().immediate().stream()
                    .anyMatch(r -> r.contains("Leverage your JavaScript experience to learn TypeScript")));
        }

        @Test
        @DisplayName("Related-category skill needs experience to clear the threshold")
        void analyze_relatedCategorySkill_needsExperience() {
            List<SkillRequirement> typescript = requirements(
                    requirement("TypeScript", Importance.IMPORTANT, SkillLevel.INTERMEDIATE));

            GapAnalysisResult novice = analyzer.analyze(skills(skill("React", SkillLevel.ADVANCED, 0.0)), typescript);
            GapAnalysisResult veteran = analyzer.analyze(skills(skill("React", SkillLevel.ADVANCED, 4.0)), typescript);

            assertTrue(novice.transferableOpportunities().isEmpty());
            assertEquals(0.6, veteran.transferableOpportunities().get(0).transferabilityScore(), 0.001);
        }

        @Test
        @DisplayName("Quick wins, long-term goals and recommendation buckets")
        void analyze_bucketsGapsByTimeToCompetency() {
            GapAnalysisResult result = analyzer.analyze(
                    List.of(),
                    requirements(
                            requirement("AWS", Importance.IMPORTANT, SkillLevel.BEGINNER),
                            requirement("Machine Learning", Importance.CRITICAL, SkillLevel.EXPERT)));

            SkillGap aws = gapFor(result, "AWS");
            SkillGap ml = gapFor(result, "Machine Learning");

            assertEquals(List.of(aws), result.quickWins());
            assertEquals(List.of(ml), result.longTermGoals());
            assertEquals(12, ml.timeToCompetency());
            assertTrue(result.recommendations().shortTerm().stream().anyMatch(r -> r.contains("AWS")));
            assertTrue(result.recommendations().longTerm().stream().anyMatch(r -> r.contains("Machine Learning")));
            assertTrue(result.recommendations().immediate().stream().anyMatch(r -> r.contains("AWS certification")));
        }
    }
}
