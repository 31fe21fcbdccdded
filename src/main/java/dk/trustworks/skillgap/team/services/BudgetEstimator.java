package dk.trustworks.skillgap.team.services;

import dk.trustworks.skillgap.config.SkillGapConfig;
import dk.trustworks.skillgap.gapanalysis.model.SkillGap;
import dk.trustworks.skillgap.team.model.BudgetEstimate;
import dk.trustworks.skillgap.team.model.TeamGap;
import dk.trustworks.skillgap.team.model.TeamMember;
import dk.trustworks.skillgap.team.model.TeamRecommendations.BudgetAllocation;
import dk.trustworks.skillgap.team.model.enums.RecommendedApproach;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Training and hiring cost estimates for team gaps.
 *
 * <p>Training a member costs {@code timeToCompetency × training-hours-per-month × (training-cost-per-hour + hourlyRate)}
 * times the training multiplier of the skill category; the member's own hourly rate stands for the time spent
 * away from billable work. Training several members in one skill gets a volume discount. Hiring for a skill
 * costs {@code hiring-fee-rate} of the salary band times the hiring premium of the category. The band is the
 * mean salary of the team when any salary is known. Gaps with a mixed solution are counted on both paths.
 *
 * <p>Categories are priced in two tiers, premium and specialized; any other category has a multiplier of 1.0.
 */
@JBossLog
@ApplicationScoped
public class BudgetEstimator {

    private final SkillGapConfig.Budget config;

    @Inject
    public BudgetEstimator(SkillGapConfig config) {
        this.config = config.budget();
    }

    public double trainingCost(TeamMember member, SkillGap gap) {
        double hourlyRate = member.hourlyRate() == null ? 0.0 : member.hourlyRate();
        double hours = (double) gap.timeToCompetency() * config.trainingHoursPerMonth();
        return round(hours * (config.trainingCostPerHour() + hourlyRate) * trainingMultiplier(gap.category()));
    }

    /**
     * Cost of training every trainee in one skill, after the volume discount.
     */
    public double teamTrainingCost(List<Trainee> trainees) {
        double total = trainees.stream()
                .mapToDouble(trainee -> trainingCost(trainee.member(), trainee.gap()))
                .sum();
        return round(total * volumeDiscount(trainees.size()));
    }

    double volumeDiscount(int trainees) {
        if (trainees > config.largeVolumeDiscountThreshold()) {
            return config.largeVolumeDiscount();
        }
        return trainees > config.volumeDiscountThreshold() ? config.volumeDiscount() : 1.0;
    }

    public double hiringCost(List<TeamMember> team, String category) {
        return round(config.hiringFeeRate() * salaryBand(team) * hiringMultiplier(category));
    }

    int positionsFor(int membersNeeding) {
        return Math.max(1, (int) Math.ceil((double) membersNeeding / Math.max(1, config.membersPerHire())));
    }

    double trainingMultiplier(String category) {
        if (inTier(category, config.premiumCategories())) {
            return config.premiumTrainingMultiplier();
        }
        return inTier(category, config.specializedCategories()) ? config.specializedTrainingMultiplier() : 1.0;
    }

    double hiringMultiplier(String category) {
        if (inTier(category, config.premiumCategories())) {
            return config.premiumHiringMultiplier();
        }
        return inTier(category, config.specializedCategories()) ? config.specializedHiringMultiplier() : 1.0;
    }

    private static boolean inTier(String category, List<String> tier) {
        return category != null && tier.stream().anyMatch(c -> c.trim().equalsIgnoreCase(category.trim()));
    }

    double salaryBand(List<TeamMember> team) {
        return team.stream()
                .map(TeamMember::salary)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(config.defaultAnnualSalary());
    }

    /**
     * Totals the training-path and hiring-path costs of the team gaps and picks an approach.
     */
    public BudgetEstimate estimate(List<TeamGap> teamGaps) {
        Map<String, Double> trainingPerSkill = new LinkedHashMap<>();
        Map<String, Double> hiringPerSkill = new LinkedHashMap<>();
        int timeline = 0;
        int positions = 0;

        for (TeamGap gap : teamGaps) {
            if (gap.recommendedSolution().includesTraining()) {
                trainingPerSkill.put(gap.skillName(), gap.estimatedTrainingCost());
                timeline = Math.max(timeline, gap.maxTimeToCompetency());
            }
            if (gap.recommendedSolution().includesHiring()) {
                hiringPerSkill.put(gap.skillName(), gap.estimatedHiringCost());
                positions += positionsFor(gap.membersNeeding());
            }
        }

        double trainingTotal = round(trainingPerSkill.values().stream().mapToDouble(Double::doubleValue).sum());
        double hiringTotal = round(hiringPerSkill.values().stream().mapToDouble(Double::doubleValue).sum());
        RecommendedApproach approach = recommendApproach(trainingTotal, hiringTotal);

        log.debugf("[BudgetEstimator] training=%.2f (%d skills), hiring=%.2f (%d positions), approach=%s",
                trainingTotal, trainingPerSkill.size(), hiringTotal, positions, approach.getValue());

        return BudgetEstimate.builder()
                .trainingCosts(new BudgetEstimate.TrainingCosts(trainingTotal, trainingPerSkill, timeline))
                .hiringCosts(new BudgetEstimate.HiringCosts(hiringTotal, hiringPerSkill, positions))
                .recommendedApproach(approach)
                .costSavings(costSavings(approach, trainingTotal, hiringTotal))
                .roiTimelineMonths(Math.max(1, timeline))
                .build();
    }

    static RecommendedApproach recommendApproach(double trainingTotal, double hiringTotal) {
        if (hiringTotal == 0.0 || trainingTotal < 0.5 * hiringTotal) {
            return RecommendedApproach.TRAINING_FOCUSED;
        }
        if (trainingTotal > 2 * hiringTotal) {
            return RecommendedApproach.HIRING_FOCUSED;
        }
        return RecommendedApproach.MIXED_APPROACH;
    }

    private static double costSavings(RecommendedApproach approach, double trainingTotal, double hiringTotal) {
        return switch (approach) {
            case TRAINING_FOCUSED -> round(Math.max(0.0, hiringTotal - trainingTotal));
            case HIRING_FOCUSED -> round(Math.max(0.0, trainingTotal - hiringTotal));
            case MIXED_APPROACH -> 0.0;
        };
    }

    /**
     * Splits the budget in proportion to the two totals. Each side gets at least
     * {@code min-allocation-percentage}; the two always add up to 100.
     */
    public BudgetAllocation allocate(BudgetEstimate estimate) {
        double training = estimate.trainingCosts().total();
        double hiring = estimate.hiringCosts().total();
        double total = training + hiring;

        int trainingPercentage = 50;
        if (total > 0.0) {
            int minimum = config.minAllocationPercentage();
            trainingPercentage = (int) Math.round(100.0 * training / total);
            trainingPercentage = Math.max(minimum, Math.min(100 - minimum, trainingPercentage));
        }
        return new BudgetAllocation(trainingPercentage, 100 - trainingPercentage, round(total));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /**
     * A member who would be trained for one of their gaps.
     */
    public record Trainee(TeamMember member, SkillGap gap) {
    }
}
