package dk.trustworks.skillgap.team.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Team-level actions derived from the team gaps, strengths and member scores.
 */
@Builder
public record TeamRecommendations(
        @JsonProperty("hiring_priorities") List<String> hiringPriorities,
        @JsonProperty("training_priorities") List<String> trainingPriorities,
        @JsonProperty("knowledge_sharing") List<String> knowledgeSharing,
        @JsonProperty("role_optimization") List<String> roleOptimization,
        @JsonProperty("budget_allocation") BudgetAllocation budgetAllocation
) {

    public TeamRecommendations {
        hiringPriorities = hiringPriorities == null ? List.of() : List.copyOf(hiringPriorities);
        trainingPriorities = trainingPriorities == null ? List.of() : List.copyOf(trainingPriorities);
        knowledgeSharing = knowledgeSharing == null ? List.of() : List.copyOf(knowledgeSharing);
        roleOptimization = roleOptimization == null ? List.of() : List.copyOf(roleOptimization);
    }

    /**
     * Split of the remediation budget. The two percentages always add up to 100.
     *
     * @param trainingPercentage Share for training.
     * @param hiringPercentage   Share for hiring.
     * @param totalBudgetNeeded  Estimated training plus hiring cost.
     */
    public record BudgetAllocation(
            @JsonProperty("training_percentage") int trainingPercentage,
            @JsonProperty("hiring_percentage") int hiringPercentage,
            @JsonProperty("total_budget_needed") double totalBudgetNeeded
    ) {
    }
}
