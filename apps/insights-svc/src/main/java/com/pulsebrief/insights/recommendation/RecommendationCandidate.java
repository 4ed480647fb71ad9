package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.model.PriorityLevel;
import com.pulsebrief.insights.model.RecommendationSource;
import java.util.List;

/**
 * Unscored recommendation produced by the rule or pattern stage. {@code level} is null for
 * pattern candidates; it is derived from the priority score later.
 */
public record RecommendationCandidate(
        String category,
        String title,
        String description,
        double urgency,
        double impact,
        double feasibility,
        double confidence,
        PriorityLevel level,
        List<String> actionItems,
        RecommendationSource source,
        String sourceKey,
        boolean pinned
) {

    public RecommendationCandidate {
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
    }

    public RecommendationCandidate withAdjustedInputs(double adjustedUrgency, double adjustedFeasibility) {
        return new RecommendationCandidate(category, title, description, adjustedUrgency, impact, adjustedFeasibility,
                confidence, level, actionItems, source, sourceKey, pinned);
    }
}
