package dk.trustworks.skillgap.team.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import dk.trustworks.skillgap.team.model.enums.RecommendedApproach;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rough cost of closing the team gaps by training and by hiring.
 * Amounts are estimates from configurable rates, not quotes.
 */
@Builder
public record BudgetEstimate(
        @JsonProperty("training_costs") TrainingCosts trainingCosts,
        @JsonProperty("hiring_costs") HiringCosts hiringCosts,
        @JsonProperty("recommended_approach") RecommendedApproach recommendedApproach,
        @JsonProperty("cost_savings") double costSavings,
        @JsonProperty("roi_timeline_months") int roiTimelineMonths
) {

    /**
     * @param total          Sum over training-path gaps.
     * @param perSkill       Training cost per skill, in team gap order.
     * @param timelineMonths Longest training-path time to competency.
     */
    public record TrainingCosts(
            @JsonProperty("total") double total,
            @JsonProperty("per_skill") Map<String, Double> perSkill,
            @JsonProperty("timeline_months") int timelineMonths
    ) {

        public TrainingCosts {
            perSkill = perSkill == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(perSkill));
        }
    }

    /**
     * @param total           Sum over hiring-path gaps.
     * @param perSkill        Hiring cost per skill, in team gap order.
     * @param positionsNeeded One position per hiring-path gap.
     */
    public record HiringCosts(
            @JsonProperty("total") double total,
            @JsonProperty("per_skill") Map<String, Double> perSkill,
            @JsonProperty("positions_needed") int positionsNeeded
    ) {

        public HiringCosts {
            perSkill = perSkill == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(perSkill));
        }
    }
}
