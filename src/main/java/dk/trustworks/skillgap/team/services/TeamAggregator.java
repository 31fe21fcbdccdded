package dk.trustworks.skillgap.team.services;

import dk.trustworks.skillgap.catalog.services.SkillMatcher;
import dk.trustworks.skillgap.config.SkillGapConfig;
import dk.trustworks.skillgap.exceptions.AggregationException;
import dk.trustworks.skillgap.exceptions.InvalidInputException;
import dk.trustworks.skillgap.gapanalysis.model.GapAnalysisResult;
import dk.trustworks.skillgap.gapanalysis.model.SkillGap;
import dk.trustworks.skillgap.gapanalysis.model.SkillRequirement;
import dk.trustworks.skillgap.gapanalysis.model.SkillStrength;
import dk.trustworks.skillgap.gapanalysis.model.enums.Importance;
import dk.trustworks.skillgap.gapanalysis.model.enums.SkillLevel;
import dk.trustworks.skillgap.gapanalysis.services.GapAnalyzer;
import dk.trustworks.skillgap.team.model.BudgetEstimate;
import dk.trustworks.skillgap.team.model.MemberAnalysis;
import dk.trustworks.skillgap.team.model.MemberOutcome;
import dk.trustworks.skillgap.team.model.ProjectRequirements;
import dk.trustworks.skillgap.team.model.TeamAnalysisMetadata;
import dk.trustworks.skillgap.team.model.TeamAnalysisResult;
import dk.trustworks.skillgap.team.model.TeamGap;
import dk.trustworks.skillgap.team.model.TeamMember;
import dk.trustworks.skillgap.team.model.TeamRecommendations;
import dk.trustworks.skillgap.team.model.TeamStrength;
import dk.trustworks.skillgap.team.model.TeamSummary;
import dk.trustworks.skillgap.team.model.enums.Coverage;
import dk.trustworks.skillgap.team.model.enums.RecommendedSolution;
import dk.trustworks.skillgap.team.model.enums.TeamGapSeverity;
import dk.trustworks.skillgap.team.services.ProjectRequirementResolver.ResolvedRequirements;
import dk.trustworks.skillgap.validation.InputValidator;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Team analysis: runs the gap analysis once per member and folds the results into team gaps,
 * team strengths, recommendations and a train-vs-hire budget.
 *
 * <p>Member analyses run on the default worker pool, at most {@code skillgap.team.max-parallelism}
 * at a time, and are joined before aggregation starts. A member whose analysis throws is kept as a
 * {@link MemberOutcome#failed failed outcome}; it counts towards the team size, gets a degraded
 * entry in {@code member_analyses} and lowers the confidence of the team result. Siblings are
 * never cancelled.
 *
 * <p>Every team gap and team strength lists the ids of the members it was derived from.
 */
@JBossLog
@ApplicationScoped
public class TeamAggregator {

    private static final int MAX_CONCURRENCY = 64;

    private final GapAnalyzer gapAnalyzer;
    private final SkillMatcher skillMatcher;
    private final InputValidator inputValidator;
    private final ProjectRequirementResolver requirementResolver;
    private final BudgetEstimator budgetEstimator;
    private final SkillGapConfig.Team config;

    @Inject
    public TeamAggregator(GapAnalyzer gapAnalyzer,
                          SkillMatcher skillMatcher,
                          InputValidator inputValidator,
                          ProjectRequirementResolver requirementResolver,
                          BudgetEstimator budgetEstimator,
                          SkillGapConfig config) {
        this.gapAnalyzer = gapAnalyzer;
        this.skillMatcher = skillMatcher;
        this.inputValidator = inputValidator;
        this.requirementResolver = requirementResolver;
        this.budgetEstimator = budgetEstimator;
        this.config = config.team();
    }

    /**
     * Analyzes a team against a project. Inputs must already have passed boundary validation.
     * Blocks until every member is analyzed, so it must not be called from an I/O thread.
     *
     * @param members team members, at least one, unique ids
     * @param project project requirements
     * @return team result with one member analysis per member
     * @throws AggregationException if merging the member results fails
     */
    public TeamAnalysisResult analyze(List<TeamMember> members, ProjectRequirements project) {
        long startTime = System.currentTimeMillis();
        ResolvedRequirements requirements = requirementResolver.resolve(project);

        log.infof("[TeamAggregator] Analyzing %d member(s) for project '%s' against %d requirement(s) (%s)",
                members.size(), project.name(), requirements.requirements().size(), requirements.source().getValue());

        try {
            List<MemberOutcome> outcomes = analyzeMembers(members, requirements.requirements());
            TeamAnalysisResult result = aggregate(members, project, requirements, outcomes, startTime);
            log.infof("[TeamAggregator] Project '%s': %d team gap(s), %d team strength(s), %d failed member(s) in %d ms",
                    project.name(), result.teamGaps().size(), result.teamStrengths().size(),
                    result.metadata().failedMembers().size(), result.metadata().processingTimeMs());
            return result;
        } catch (AggregationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AggregationException("Failed to aggregate team analysis for project '" + project.name() + "'", e);
        }
    }

    // ========== Fan-out / fan-in ==========

    /**
     * Analyzes every member and waits for all of them. The outcomes are in member order.
     */
    List<MemberOutcome> analyzeMembers(List<TeamMember> members, List<SkillRequirement> requirements) {
        List<Uni<MemberOutcome>> memberUnis = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            memberUnis.add(analyzeMember(members.get(i), "members[" + i + "].skills", requirements));
        }

        return Uni.join().all(memberUnis)
                .usingConcurrencyOf(Math.max(1, Math.min(MAX_CONCURRENCY, config.maxParallelism())))
                .andCollectFailures()
                .await().indefinitely();
    }

    private Uni<MemberOutcome> analyzeMember(TeamMember member, String path, List<SkillRequirement> requirements) {
        return Uni.createFrom().item(() -> {
                    inputValidator.validateSkills(member.skills(), path);
                    return MemberOutcome.analyzed(member, gapAnalyzer.analyze(member.skills(), requirements));
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .onFailure().recoverWithItem(failure -> {
                    String reason = failureReason(failure);
                    log.warnf("[TeamAggregator] Analysis of member %s failed, continuing with a degraded result: %s",
                            member.id(), reason);
                    return MemberOutcome.failed(member, reason);
                });
    }

    private static String failureReason(Throwable e) {
        if (e instanceof InvalidInputException invalid && !invalid.getViolations().isEmpty()) {
            return invalid.getViolations().stream()
                    .map(InvalidInputException.Violation::toString)
                    .collect(Collectors.joining("; "));
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    // ========== Aggregation ==========

    private TeamAnalysisResult aggregate(List<TeamMember> members, ProjectRequirements project,
                                         ResolvedRequirements requirements, List<MemberOutcome> outcomes, long startTime) {
        int totalMembers = members.size();
        if (outcomes.size() != totalMembers) {
            throw new AggregationException("Expected " + totalMembers + " member outcomes but got " + outcomes.size());
        }

        List<MemberOutcome> analyzed = outcomes.stream().filter(outcome -> !outcome.isFailed()).toList();
        List<String> failedIds = outcomes.stream().filter(MemberOutcome::isFailed).map(outcome -> outcome.member().id()).toList();
        List<MemberAnalysis> memberAnalyses = outcomes.stream().map(MemberAnalysis::from).toList();

        List<TeamGap> teamGaps = detectTeamGaps(members, analyzed, totalMembers);
        List<TeamStrength> teamStrengths = detectTeamStrengths(analyzed, totalMembers);
        BudgetEstimate budget = budgetEstimator.estimate(teamGaps);

        TeamSummary summary = TeamSummary.builder()
                .totalMembers(totalMembers)
                .analyzedMembers(analyzed.size())
                .overallMatch((int) Math.round(memberAnalyses.stream()
                        .mapToInt(analysis -> analysis.analysis().overallMatchPercentage())
                        .average()
                        .orElse(0.0)))
                .criticalGapsCount((int) teamGaps.stream().filter(gap -> gap.severity() == TeamGapSeverity.CRITICAL).count())
                .teamStrengthsCount(teamStrengths.size())
                .skillCoveragePercentage(skillCoverage(requirements.requirements(), analyzed))
                .build();

        return TeamAnalysisResult.builder()
                .analysisId(UUID.randomUUID().toString())
                .project(project)
                .teamSummary(summary)
                .memberAnalyses(memberAnalyses)
                .teamGaps(teamGaps)
                .teamStrengths(teamStrengths)
                .recommendations(recommend(members, memberAnalyses, analyzed, teamGaps, teamStrengths, budget))
                .budgetEstimates(budget)
                .metadata(TeamAnalysisMetadata.builder()
                        .teamSize(totalMembers)
                        .processingTimeMs(System.currentTimeMillis() - startTime)
                        .analysisConfidence(confidence(analyzed, !failedIds.isEmpty()))
                        .analysisTimestamp(Instant.now())
                        .projectSkillsAnalyzed(requirements.requirements().size())
                        .requirementsSource(requirements.source())
                        .failedMembers(failedIds)
                        .build())
                .build();
    }

    List<TeamGap> detectTeamGaps(List<TeamMember> members, List<MemberOutcome> analyzed, int totalMembers) {
        Map<String, List<MemberGap>> bySkill = new LinkedHashMap<>();
        for (MemberOutcome outcome : analyzed) {
            for (SkillGap gap : outcome.result().skillGaps()) {
                bySkill.computeIfAbsent(gap.skillName(), k -> new ArrayList<>()).add(new MemberGap(outcome.member(), gap));
            }
        }

        List<TeamGap> teamGaps = new ArrayList<>();
        for (Map.Entry<String, List<MemberGap>> entry : bySkill.entrySet()) {
            List<MemberGap> needing = entry.getValue();
            double ratio = (double) needing.size() / totalMembers;
            if (ratio < config.gapThreshold()) {
                continue;
            }

            boolean criticalImportance = needing.stream().anyMatch(g -> g.gap().importance() == Importance.CRITICAL);
            TeamGapSeverity severity = criticalImportance || ratio >= config.criticalThreshold()
                    ? TeamGapSeverity.CRITICAL
                    : TeamGapSeverity.MODERATE;
            double averageTtc = needing.stream().mapToInt(g -> g.gap().timeToCompetency()).average().orElse(0.0);
            int maxTtc = needing.stream().mapToInt(g -> g.gap().timeToCompetency()).max().orElse(0);
            boolean proficient = !proficientMembers(entry.getKey(), analyzed).isEmpty();
            String category = needing.get(0).gap().category();

            teamGaps.add(TeamGap.builder()
                    .skillName(entry.getKey())
                    .category(category)
                    .membersNeeding(needing.size())
                    .percentageNeeding((int) Math.round(100.0 * ratio))
                    .severity(severity)
                    .averageTimeToCompetency(Math.round(averageTtc * 10.0) / 10.0)
                    .maxTimeToCompetency(maxTtc)
                    .estimatedTrainingCost(budgetEstimator.teamTrainingCost(needing.stream()
                            .map(g -> new BudgetEstimator.Trainee(g.member(), g.gap()))
                            .toList()))
                    .estimatedHiringCost(budgetEstimator.hiringCost(members, category))
                    .recommendedSolution(recommendSolution(severity, proficient, averageTtc))
                    .memberIds(needing.stream().map(g -> g.member().id()).toList())
                    .build());
        }

        teamGaps.sort(Comparator.comparing((TeamGap gap) -> gap.severity() == TeamGapSeverity.CRITICAL ? 0 : 1)
                .thenComparing(Comparator.comparingInt(TeamGap::membersNeeding).reversed())
                .thenComparing(TeamGap::skillName));
        return teamGaps;
    }

    RecommendedSolution recommendSolution(TeamGapSeverity severity, boolean proficiencyOnTeam, double averageTimeToCompetency) {
        if (severity == TeamGapSeverity.CRITICAL) {
            return proficiencyOnTeam ? RecommendedSolution.MIXED : RecommendedSolution.HIRING;
        }
        return averageTimeToCompetency <= config.trainingMaxMonths() ? RecommendedSolution.TRAINING : RecommendedSolution.MIXED;
    }

    /**
     * Members holding the skill above beginner level, either as a strength or as a partial gap.
     */
    private static List<TeamMember> proficientMembers(String skillName, List<MemberOutcome> analyzed) {
        List<TeamMember> proficient = new ArrayList<>();
        for (MemberOutcome outcome : analyzed) {
            GapAnalysisResult result = outcome.result();
            boolean strong = result.strengths().stream()
                    .anyMatch(s -> s.skillName().equals(skillName) && s.level().isAbove(SkillLevel.BEGINNER));
            boolean partial = result.skillGaps().stream()
                    .anyMatch(g -> g.skillName().equals(skillName) && !g.isMissing() && g.currentLevel().isAbove(SkillLevel.BEGINNER));
            if (strong || partial) {
                proficient.add(outcome.member());
            }
        }
        return proficient;
    }

    List<TeamStrength> detectTeamStrengths(List<MemberOutcome> analyzed, int totalMembers) {
        Map<String, List<MemberStrength>> bySkill = new LinkedHashMap<>();
        for (MemberOutcome outcome : analyzed) {
            for (SkillStrength strength : outcome.result().strengths()) {
                bySkill.computeIfAbsent(strength.skillName(), k -> new ArrayList<>())
                        .add(new MemberStrength(outcome.member(), strength));
            }
        }

        List<TeamStrength> teamStrengths = new ArrayList<>();
        for (Map.Entry<String, List<MemberStrength>> entry : bySkill.entrySet()) {
            List<MemberStrength> having = entry.getValue();
            double ratio = (double) having.size() / totalMembers;
            if (ratio < config.strengthThreshold()) {
                continue;
            }
            double meanRank = having.stream().mapToInt(s -> s.strength().level().rank()).average().orElse(0.0);

            teamStrengths.add(TeamStrength.builder()
                    .skillName(entry.getKey())
                    .membersHaving(having.size())
                    .percentageHaving((int) Math.round(100.0 * ratio))
                    .coverage(ratio >= config.excellentCoverageThreshold() ? Coverage.EXCELLENT : Coverage.GOOD)
                    .expertiseLevel(expertiseLevel(meanRank))
                    .memberIds(having.stream().map(s -> s.member().id()).toList())
                    .build());
        }

        teamStrengths.sort(Comparator.comparingInt(TeamStrength::membersHaving).reversed()
                .thenComparing(Comparator.comparingInt((TeamStrength s) -> s.expertiseLevel().rank()).reversed())
                .thenComparing(TeamStrength::skillName));
        return teamStrengths;
    }

    static SkillLevel expertiseLevel(double meanRank) {
        if (meanRank >= 3.5) {
            return SkillLevel.EXPERT;
        }
        if (meanRank >= 2.5) {
            return SkillLevel.ADVANCED;
        }
        return meanRank >= 1.5 ? SkillLevel.INTERMEDIATE : SkillLevel.BEGINNER;
    }

    private int skillCoverage(List<SkillRequirement> requirements, List<MemberOutcome> analyzed) {
        Set<String> required = requirements.stream()
                .map(requirement -> skillMatcher.resolve(requirement.skill()).canonicalName())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (required.isEmpty()) {
            return 100;
        }
        long covered = required.stream()
                .filter(skill -> analyzed.stream()
                        .anyMatch(outcome -> outcome.result().strengths().stream()
                                .anyMatch(s -> s.required() && s.skillName().equals(skill))))
                .count();
        return (int) Math.round(100.0 * covered / required.size());
    }

    private double confidence(List<MemberOutcome> analyzed, boolean anyFailed) {
        double mean = analyzed.stream()
                .mapToDouble(outcome -> outcome.result().metadata().analysisConfidence())
                .average()
                .orElse(0.0);
        if (anyFailed) {
            mean *= config.failedMemberConfidenceDiscount();
        }
        return Math.round(mean * 100.0) / 100.0;
    }

    // ========== Recommendations ==========

    private TeamRecommendations recommend(List<TeamMember> members, List<MemberAnalysis> memberAnalyses,
                                          List<MemberOutcome> analyzed, List<TeamGap> teamGaps,
                                          List<TeamStrength> teamStrengths, BudgetEstimate budget) {
        Map<String, String> names = members.stream()
                .collect(Collectors.toMap(TeamMember::id, TeamMember::displayName, (a, b) -> a, LinkedHashMap::new));
        int totalMembers = members.size();

        List<String> hiring = new ArrayList<>();
        List<String> training = new ArrayList<>();
        List<String> knowledgeSharing = new ArrayList<>();
        List<String> roleOptimization = new ArrayList<>();

        for (TeamGap gap : teamGaps) {
            if (gap.recommendedSolution() == RecommendedSolution.HIRING) {
                hiring.add(String.format("Hire for %s: %d of %d members lack it and nobody on the team is above beginner level",
                        gap.skillName(), gap.membersNeeding(), totalMembers));
            }
        }
        for (TeamGap gap : teamGaps) {
            if (gap.recommendedSolution() == RecommendedSolution.TRAINING) {
                training.add(String.format("Train %d member(s) in %s (about %.1f months on average)",
                        gap.membersNeeding(), gap.skillName(), gap.averageTimeToCompetency()));
            }
        }
        for (TeamGap gap : teamGaps) {
            if (gap.recommendedSolution() == RecommendedSolution.MIXED) {
                training.add(String.format("Upskill %d member(s) in %s alongside a targeted hire",
                        gap.membersNeeding(), gap.skillName()));
            }
        }

        teamStrengths.stream()
                .limit(config.maxKnowledgeSharingSuggestions())
                .forEach(strength -> knowledgeSharing.add(String.format(
                        "Pair %s with less experienced teammates to spread %s knowledge (%s coverage, %s level)",
                        joinNames(strength.memberIds(), names), strength.skillName(),
                        strength.coverage().getValue(), strength.expertiseLevel().getValue())));
        for (TeamGap gap : teamGaps) {
            if (gap.recommendedSolution() == RecommendedSolution.MIXED) {
                List<String> mentorIds = proficientMembers(gap.skillName(), analyzed).stream().map(TeamMember::id).toList();
                if (!mentorIds.isEmpty()) {
                    knowledgeSharing.add(String.format("Let %s mentor the team in %s while a hire is found",
                            joinNames(mentorIds, names), gap.skillName()));
                }
            }
        }

        for (MemberAnalysis analysis : memberAnalyses) {
            String name = names.get(analysis.memberId());
            if (analysis.isFailed()) {
                roleOptimization.add(String.format("Re-run the analysis for %s after fixing their skill profile: %s",
                        name, analysis.failureReason()));
            } else if (analysis.analysis().overallMatchPercentage() < config.roleReviewThreshold()) {
                roleOptimization.add(String.format("Review role fit or a training plan for %s%s (%d%% match)",
                        name, analysis.role() == null ? "" : " (" + analysis.role() + ")",
                        analysis.analysis().overallMatchPercentage()));
            }
        }

        return TeamRecommendations.builder()
                .hiringPriorities(hiring)
                .trainingPriorities(training)
                .knowledgeSharing(knowledgeSharing)
                .roleOptimization(roleOptimization)
                .budgetAllocation(budgetEstimator.allocate(budget))
                .build();
    }

    private static String joinNames(List<String> memberIds, Map<String, String> names) {
        return memberIds.stream().map(id -> names.getOrDefault(id, id)).collect(Collectors.joining(", "));
    }

    private record MemberGap(TeamMember member, SkillGap gap) {
    }

    private record MemberStrength(TeamMember member, SkillStrength strength) {
    }
}
