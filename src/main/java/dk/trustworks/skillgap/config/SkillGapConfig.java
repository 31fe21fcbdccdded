package dk.trustworks.skillgap.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;

/**
 * Tunable constants of the skill gap pipeline.
 *
 * <p>Example configuration in application.properties:
 * <pre>
 * skillgap.matching.fuzzy-threshold=0.8
 * skillgap.gap.months-per-level=2
 * skillgap.team.gap-threshold=0.5
 * skillgap.budget.training-cost-per-hour=50
 * </pre>
 *
 * Dollar figures are estimates, not contracts; override them per deployment.
 */
@ConfigMapping(prefix = "skillgap")
public interface SkillGapConfig {

    Matching matching();

    Gap gap();

    Transfer transfer();

    Team team();

    Budget budget();

    interface Matching {
        /**
         * Classpath location of the skill catalog JSON document.
         */
        @WithDefault("skill-catalog.json")
        String catalogLocation();

        /**
         * Minimum normalized similarity (0-1) for a fuzzy catalog match.
         */
        @WithDefault("0.8")
        double fuzzyThreshold();

        /**
         * Category given to skills the catalog does not know.
         */
        @WithDefault("General")
        String unknownCategory();

        @WithDefault("0.5")
        double unknownConfidence();
    }

    interface Gap {
        @WithDefault("2")
        int monthsPerLevel();

        /**
         * Categories that historically take longer to learn.
         */
        @WithDefault("AI & Machine Learning,Cloud & DevOps,Data Science & Analytics,Security,Hardware")
        List<String> slowLearningCategories();

        @WithDefault("1.5")
        double slowLearningMultiplier();

        /**
         * Gaps needing more months than this are long-term goals.
         */
        @WithDefault("4")
        int shortTermMaxMonths();
    }

    interface Transfer {
        @WithDefault("0.5")
        double sameCategoryBase();

        @WithDefault("0.3")
        double relatedCategoryBase();

        @WithDefault("0.1")
        double perYearBonus();

        @WithDefault("0.3")
        double maxExperienceBonus();

        @WithDefault("0.4")
        double minimumScore();
    }

    interface Team {
        /**
         * Share of the team that must lack a skill before it is a team gap.
         */
        @WithDefault("0.5")
        double gapThreshold();

        @WithDefault("0.8")
        double criticalThreshold();

        @WithDefault("0.5")
        double strengthThreshold();

        @WithDefault("0.8")
        double excellentCoverageThreshold();

        /**
         * Members below this match percentage are named in role optimization.
         */
        @WithDefault("65")
        int roleReviewThreshold();

        /**
         * Average months to competency up to which training is preferred over mixed.
         */
        @WithDefault("6")
        int trainingMaxMonths();

        /**
         * Member analyses running at the same time, between 1 and 64.
         */
        @WithDefault("8")
        int maxParallelism();

        @WithDefault("0.9")
        double failedMemberConfidenceDiscount();

        @WithDefault("3")
        int maxKnowledgeSharingSuggestions();
    }

    interface Budget {
        @WithDefault("50")
        double trainingCostPerHour();

        @WithDefault("20")
        int trainingHoursPerMonth();

        /**
         * One-time hiring cost as a share of the annual salary band.
         */
        @WithDefault("0.2")
        double hiringFeeRate();

        @WithDefault("100000")
        double defaultAnnualSalary();

        @WithDefault("10")
        int minAllocationPercentage();

        /**
         * Categories with the most expensive training and the highest hiring premium.
         */
        @WithDefault("AI & Machine Learning")
        List<String> premiumCategories();

        @WithDefault("2.0")
        double premiumTrainingMultiplier();

        @WithDefault("2.5")
        double premiumHiringMultiplier();

        /**
         * Specialized categories, priced between premium and standard.
         */
        @WithDefault("Cloud & DevOps,Security")
        List<String> specializedCategories();

        @WithDefault("1.5")
        double specializedTrainingMultiplier();

        @WithDefault("1.8")
        double specializedHiringMultiplier();

        /**
         * More trainees than this for one skill get {@code volume-discount}.
         */
        @WithDefault("2")
        int volumeDiscountThreshold();

        @WithDefault("0.9")
        double volumeDiscount();

        @WithDefault("5")
        int largeVolumeDiscountThreshold();

        @WithDefault("0.8")
        double largeVolumeDiscount();

        /**
         * Members needing a skill that one hire can cover.
         */
        @WithDefault("3")
        int membersPerHire();
    }
}
