package dk.trustworks.skillgap.gapanalysis.services;

import dk.trustworks.skillgap.catalog.model.SkillMatch;
import dk.trustworks.skillgap.catalog.services.SkillCatalog;
import dk.trustworks.skillgap.catalog.services.SkillMatcher;
import dk.trustworks.skillgap.config.SkillGapConfig;
import dk.trustworks.skillgap.gapanalysis.model.AnalysisMetadata;
import dk.trustworks.skillgap.gapanalysis.model.GapAnalysisResult;
import dk.trustworks.skillgap.gapanalysis.model.Recommendations;
import dk.trustworks.skillgap.gapanalysis.model.SkillGap;
import dk.trustworks.skillgap.gapanalysis.model.SkillRequirement;
import dk.trustworks.skillgap.gapanalysis.model.SkillStrength;
import dk.trustworks.skillgap.gapanalysis.model.TransferableSkill;
import dk.trustworks.skillgap.gapanalysis.model.UserSkill;
import dk.trustworks.skillgap.gapanalysis.model.enums.GapSeverity;
import dk.trustworks.skillgap.gapanalysis.model.enums.Importance;
import dk.trustworks.skillgap.gapanalysis.model.enums.LearningDifficulty;
import dk.trustworks.skillgap.gapanalysis.model.enums.SkillLevel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares one person's skills against a list of requirements.
 *
 * <p>Every requirement ends up either as a strength or as a {@link SkillGap}. Gaps are scored for
 * severity, learning difficulty, time to competency and priority, and turned into time-bucketed
 * recommendations. Skill names on both sides are resolved through {@link SkillMatcher} first, so
 * "JS" on a CV satisfies a "JavaScript" requirement.
 *
 * <p>The analysis is a pure function of its inputs and the catalog; only
 * {@code metadata.processingTimeMs} differs between identical calls.
 */
@JBossLog
@ApplicationScoped
public class GapAnalyzer {

    private final SkillMatcher skillMatcher;
    private final SkillCatalog catalog;
    private final SkillGapConfig.Gap gapConfig;
    private final SkillGapConfig.Transfer transferConfig;

    @Inject
    public GapAnalyzer(SkillMatcher skillMatcher, SkillCatalog catalog, SkillGapConfig config) {
        this.skillMatcher = skillMatcher;
        this.catalog = catalog;
        this.gapConfig = config.gap();
        this.transferConfig = config.transfer();
    }

    /**
     * Analyzes one person against a requirement list.
     *
     * @param userSkills   the person's declared skills, may be empty
     * @param requirements requirements to meet, may be empty and may repeat a skill
     * @return the analysis; {@code overallMatchPercentage} is 100 when there is nothing to meet
     */
    public GapAnalysisResult analyze(List<UserSkill> userSkills, List<SkillRequirement> requirements) {
        long startTime = System.currentTimeMillis();
        List<String> notes = new ArrayList<>();

        Map<String, HeldSkill> held = resolveUserSkills(userSkills == null ? List.of() : userSkills, notes);
        List<ResolvedRequirement> resolved = mergeRequirements(requirements == null ? List.of() : requirements, notes);

        if (resolved.isEmpty()) {
            List<SkillStrength> strengths = held.values().stream()
                    .map(skill -> skill.toStrength(false, null))
                    .toList();
            log.debugf("[GapAnalyzer] No requirements, %d skill(s) reported as strengths", strengths.size());
            return GapAnalysisResult.builder()
                    .overallMatchPercentage(100)
                    .strengths(strengths)
                    .metadata(AnalysisMetadata.builder()
                            .totalSkillsAnalyzed(held.size())
                            .strengthsIdentified(strengths.size())
                            .analysisConfidence(1.0)
                            .processingTimeMs(System.currentTimeMillis() - startTime)
                            .notes(notes)
                            .build())
                    .build();
        }

        List<SkillGap> gaps = new ArrayList<>();
        List<HeldSkill> requiredStrengths = new ArrayList<>();
        Map<String, SkillLevel> requiredLevels = new LinkedHashMap<>();
        int satisfiedWeight = 0;
        int totalWeight = 0;
        double confidenceSum = 0.0;

        for (ResolvedRequirement requirement : resolved) {
            HeldSkill skill = held.get(requirement.canonicalName());
            double confidence = requirement.confidence() * (skill == null ? 1.0 : skill.match().confidence());
            confidenceSum += confidence;
            totalWeight += requirement.importance().matchWeight();

            if (skill != null && skill.level().meets(requirement.minimumLevel())) {
                satisfiedWeight += requirement.importance().matchWeight();
                requiredStrengths.add(skill);
                requiredLevels.put(skill.canonicalName(), requirement.minimumLevel());
            } else {
                gaps.add(buildGap(requirement, skill, confidence));
            }
        }

        gaps.sort(Comparator.comparingInt(SkillGap::priority).reversed()
                .thenComparing(Comparator.comparingInt(SkillGap::levelGap).reversed())
                .thenComparing(SkillGap::skillName));

        List<SkillStrength> strengths = collectStrengths(held, requiredStrengths, requiredLevels);
        List<SkillGap> criticalGaps = gaps.stream()
                .filter(gap -> gap.gapSeverity() == GapSeverity.CRITICAL)
                .toList();
        List<SkillGap> quickWins = gaps.stream()
                .filter(gap -> gap.learningDifficulty() == LearningDifficulty.EASY && gap.levelGap() <= 1)
                .toList();
        List<SkillGap> longTermGoals = gaps.stream()
                .filter(gap -> gap.timeToCompetency() > gapConfig.shortTermMaxMonths())
                .toList();
        List<TransferableSkill> transferable = findTransferableSkills(gaps, held);

        int overallMatch = clamp((int) Math.round(100.0 * satisfiedWeight / totalWeight), 0, 100);
        double analysisConfidence = round(confidenceSum / resolved.size());

        log.debugf("[GapAnalyzer] %d requirement(s): match=%d%%, gaps=%d, strengths=%d",
                resolved.size(), overallMatch, gaps.size(), strengths.size());

        return GapAnalysisResult.builder()
                .overallMatchPercentage(overallMatch)
                .skillGaps(gaps)
                .strengths(strengths)
                .criticalGaps(criticalGaps)
                .quickWins(quickWins)
                .longTermGoals(longTermGoals)
                .transferableOpportunities(transferable)
                .recommendations(buildRecommendations(gaps, criticalGaps, quickWins, transferable))
                .metadata(AnalysisMetadata.builder()
                        .totalSkillsAnalyzed(resolved.size())
                        .gapsIdentified(gaps.size())
                        .strengthsIdentified(strengths.size())
                        .analysisConfidence(analysisConfidence)
                        .processingTimeMs(System.currentTimeMillis() - startTime)
                        .notes(notes)
                        .build())
                .build();
    }

    // ========== Resolution ==========

    private Map<String, HeldSkill> resolveUserSkills(List<UserSkill> userSkills, List<String> notes) {
        Map<String, HeldSkill> held = new LinkedHashMap<>();
        Set<String> unrecognized = new TreeSet<>();
        for (UserSkill userSkill : userSkills) {
            SkillMatch match = skillMatcher.resolve(userSkill.skillName());
            if (!match.isKnown()) {
                unrecognized.add(match.canonicalName());
            }
            String category = StringUtils.isNotBlank(userSkill.skillCategory()) ? userSkill.skillCategory() : match.category();
            HeldSkill candidate = new HeldSkill(userSkill, match, category);
            // Highest declared level wins, then most experience
            held.merge(match.canonicalName(), candidate, (current, other) -> other.outranks(current) ? other : current);
        }
        if (held.size() < userSkills.size()) {
            notes.add("Merged " + (userSkills.size() - held.size()) + " duplicate skill declaration(s)");
        }
        if (!unrecognized.isEmpty()) {
            notes.add("Skills not in catalog: " + String.join(", ", unrecognized));
        }
        return held;
    }

    private List<ResolvedRequirement> mergeRequirements(List<SkillRequirement> requirements, List<String> notes) {
        Map<String, ResolvedRequirement> merged = new LinkedHashMap<>();
        for (SkillRequirement requirement : requirements) {
            SkillMatch match = skillMatcher.resolve(requirement.skill());
            ResolvedRequirement candidate = new ResolvedRequirement(
                    match.canonicalName(),
                    StringUtils.isNotBlank(requirement.category()) ? requirement.category() : match.category(),
                    requirement.importance(),
                    requirement.minimumLevel(),
                    requirement.confidence() * match.confidence(),
                    requirement.yearsRequired());
            merged.merge(match.canonicalName(), candidate, ResolvedRequirement::mergeWith);
        }
        if (merged.size() < requirements.size()) {
            notes.add("Merged " + (requirements.size() - merged.size()) + " duplicate requirement(s)");
        }
        return new ArrayList<>(merged.values());
    }

    // ========== Scoring ==========

    private SkillGap buildGap(ResolvedRequirement requirement, HeldSkill skill, double confidence) {
        SkillLevel currentLevel = skill == null ? null : skill.level();
        int levelGap = requirement.minimumLevel().gapFrom(currentLevel);
        GapSeverity severity = severity(requirement.importance(), levelGap, skill == null);

        Double experienceGap = null;
        if (requirement.yearsRequired() != null) {
            double years = skill == null ? 0.0 : skill.source().years();
            experienceGap = Math.max(0.0, requirement.yearsRequired() - years);
        }

        return SkillGap.builder()
                .skillName(requirement.canonicalName())
                .category(requirement.category())
                .currentLevel(currentLevel)
                .requiredLevel(requirement.minimumLevel())
                .levelGap(levelGap)
                .experienceGap(experienceGap)
                .gapSeverity(severity)
                .learningDifficulty(LearningDifficulty.forLevelGap(levelGap))
                .timeToCompetency(timeToCompetency(levelGap, requirement.category()))
                .priority(priority(requirement.importance(), severity, confidence))
                .importance(requirement.importance())
                .confidence(round(confidence))
                .build();
    }

    static GapSeverity severity(Importance importance, int levelGap, boolean missing) {
        if (importance == Importance.CRITICAL && (levelGap >= 2 || missing)) {
            return GapSeverity.CRITICAL;
        }
        if (levelGap == 1 && importance != Importance.NICE_TO_HAVE) {
            return GapSeverity.MODERATE;
        }
        if (levelGap >= 2 && importance == Importance.IMPORTANT) {
            return GapSeverity.MODERATE;
        }
        return GapSeverity.MINOR;
    }

    int timeToCompetency(int levelGap, String category) {
        double multiplier = isSlowLearning(category) ? gapConfig.slowLearningMultiplier() : 1.0;
        return Math.max(1, (int) Math.round(levelGap * gapConfig.monthsPerLevel() * multiplier));
    }

    static int priority(Importance importance, GapSeverity severity, double confidence) {
        double raw = importance.priorityWeight() + severity.priorityWeight() + Math.min(1.0, Math.max(0.0, confidence));
        return clamp((int) Math.round(raw), 1, 10);
    }

    private boolean isSlowLearning(String category) {
        return category != null && gapConfig.slowLearningCategories().stream()
                .anyMatch(slow -> slow.trim().equalsIgnoreCase(category));
    }

    // ========== Strengths & transferable skills ==========

    private List<SkillStrength> collectStrengths(Map<String, HeldSkill> held, List<HeldSkill> requiredStrengths,
                                                 Map<String, SkillLevel> requiredLevels) {
        List<SkillStrength> strengths = new ArrayList<>();
        requiredStrengths.stream()
                .sorted(Comparator.comparingDouble((HeldSkill skill) -> skill.source().effectiveConfidence()).reversed())
                .map(skill -> skill.toStrength(true, requiredLevels.get(skill.canonicalName())))
                .forEach(strengths::add);

        held.values().stream()
                .filter(skill -> !requiredLevels.containsKey(skill.canonicalName()))
                .filter(skill -> skill.level().meets(SkillLevel.ADVANCED))
                .sorted(Comparator.comparingInt((HeldSkill skill) -> skill.level().rank()).reversed())
                .map(skill -> skill.toStrength(false, null))
                .forEach(strengths::add);
        return strengths;
    }

    private List<TransferableSkill> findTransferableSkills(List<SkillGap> gaps, Map<String, HeldSkill> held) {
        List<TransferableSkill> opportunities = new ArrayList<>();
        for (SkillGap gap : gaps) {
            for (HeldSkill skill : held.values()) {
                if (skill.canonicalName().equals(gap.skillName())) {
                    continue;
                }
                boolean sameCategory = skill.category().equalsIgnoreCase(gap.category());
                boolean related = !sameCategory && catalog.areRelated(skill.category(), gap.category());
                if (!sameCategory && !related) {
                    continue;
                }

                double base = sameCategory ? transferConfig.sameCategoryBase() : transferConfig.relatedCategoryBase();
                double bonus = Math.min(skill.source().years() * transferConfig.perYearBonus(), transferConfig.maxExperienceBonus());
                double score = round(Math.min(1.0, base + bonus));
                if (score < transferConfig.minimumScore()) {
                    continue;
                }

                String reasoning = sameCategory
                        ? String.format("%s is in the same category (%s) as %s; %.1f year(s) of experience carry over",
                                skill.canonicalName(), gap.category(), gap.skillName(), skill.source().years())
                        : String.format("%s (%s) builds on concepts related to %s (%s); %.1f year(s) of experience carry over",
                                skill.canonicalName(), skill.category(), gap.skillName(), gap.category(), skill.source().years());
                opportunities.add(new TransferableSkill(skill.source(), gap.skillName(), gap.category(), score, reasoning));
            }
        }
        opportunities.sort(Comparator.comparingDouble(TransferableSkill::transferabilityScore).reversed()
                .thenComparing(TransferableSkill::toSkillName)
                .thenComparing(opportunity -> opportunity.fromSkill().skillName()));
        return opportunities;
    }

    // ========== Recommendations ==========

    private Recommendations buildRecommendations(List<SkillGap> gaps, List<SkillGap> criticalGaps,
                                                 List<SkillGap> quickWins, List<TransferableSkill> transferable) {
        Set<String> immediate = new LinkedHashSet<>();
        Set<String> shortTerm = new LinkedHashSet<>();
        Set<String> longTerm = new LinkedHashSet<>();

        if (!transferable.isEmpty()) {
            TransferableSkill best = transferable.get(0);
            immediate.add(String.format("Leverage your %s experience to learn %s faster",
                    skillMatcher.resolve(best.fromSkill().skillName()).canonicalName(), best.toSkillName()));
        }

        for (SkillGap gap : gaps) {
            bucketFor(gap, immediate, shortTerm, longTerm).add(describe(gap));
            // Critical gaps and quick wins get a concrete first step right away
            if (criticalGaps.contains(gap) || quickWins.contains(gap)) {
                String advice = categoryAdvice(gap);
                if (advice != null) {
                    immediate.add(advice);
                }
            }
        }
        return new Recommendations(List.copyOf(immediate), List.copyOf(shortTerm), List.copyOf(longTerm));
    }

    private Set<String> bucketFor(SkillGap gap, Set<String> immediate, Set<String> shortTerm, Set<String> longTerm) {
        if (gap.timeToCompetency() <= 1) {
            return immediate;
        }
        return gap.timeToCompetency() <= gapConfig.shortTermMaxMonths() ? shortTerm : longTerm;
    }

    private String describe(SkillGap gap) {
        String target = gap.requiredLevel().getValue();
        if (gap.isMissing()) {
            return String.format("Start learning %s and reach %s level (about %d month%s)",
                    gap.skillName(), target, gap.timeToCompetency(), gap.timeToCompetency() == 1 ? "" : "s");
        }
        return String.format("Develop %s from %s to %s level (about %d month%s)",
                gap.skillName(), gap.currentLevel().getValue(), target, gap.timeToCompetency(),
                gap.timeToCompetency() == 1 ? "" : "s");
    }

    private static String categoryAdvice(SkillGap gap) {
        if (gap.category() == null) {
            return null;
        }
        return switch (gap.category()) {
            case "Programming" -> "Take a hands-on " + gap.skillName() + " course with coding exercises";
            case "Cloud & DevOps" -> "Pursue an official " + gap.skillName() + " certification to validate practical cloud skills";
            case "Frameworks & Libraries" -> "Build a small practical project with " + gap.skillName();
            default -> null;
        };
    }

    // ========== Helpers ==========

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private record HeldSkill(UserSkill source, SkillMatch match, String category) {

        String canonicalName() {
            return match.canonicalName();
        }

        SkillLevel level() {
            return source.level();
        }

        boolean outranks(HeldSkill other) {
            if (level() != other.level()) {
                return level().isAbove(other.level());
            }
            return source.years() > other.source().years();
        }

        SkillStrength toStrength(boolean required, SkillLevel requiredLevel) {
            return new SkillStrength(canonicalName(), category, level(), source.years(), required, requiredLevel, source);
        }
    }

    private record ResolvedRequirement(String canonicalName, String category, Importance importance,
                                       SkillLevel minimumLevel, double confidence, Double yearsRequired) {

        ResolvedRequirement mergeWith(ResolvedRequirement other) {
            Double years;
            if (yearsRequired == null) {
                years = other.yearsRequired;
            } else if (other.yearsRequired == null) {
                years = yearsRequired;
            } else {
                years = Math.max(yearsRequired, other.yearsRequired);
            }
            return new ResolvedRequirement(
                    canonicalName,
                    category,
                    importance.matchWeight() >= other.importance.matchWeight() ? importance : other.importance,
                    minimumLevel.meets(other.minimumLevel) ? minimumLevel : other.minimumLevel,
                    Math.max(confidence, other.confidence),
                    years);
        }
    }
}
