package com.pulsebrief.insights.rules;

import com.pulsebrief.insights.error.ConfigurationException;
import com.pulsebrief.insights.model.Timeframe;
import com.pulsebrief.insights.model.TrendDirection;
import java.util.List;

/**
 * Named multi-KPI directional pattern. A pattern with a {@link Scenario} also produces a
 * recommendation candidate when it matches.
 */
public record PatternDefinition(
        String name,
        String description,
        Double matchFraction,
        List<Condition> conditions,
        Scenario scenario
) {

    public PatternDefinition {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public PatternDefinition validate() {
        String patternName = name == null ? "<unnamed pattern>" : name;
        if (name == null || name.isBlank()) {
            throw new ConfigurationException(patternName, "pattern name is required");
        }
        if (conditions.isEmpty()) {
            throw new ConfigurationException(patternName, "pattern has no conditions");
        }
        for (Condition condition : conditions) {
            if (condition == null || condition.kpi() == null || condition.timeframe() == null
                    || condition.directions() == null || condition.directions().isEmpty()) {
                throw new ConfigurationException(patternName, "every condition needs a kpi, timeframe and directions");
            }
        }
        if (matchFraction != null && (matchFraction <= 0d || matchFraction > 1d)) {
            throw new ConfigurationException(patternName, "matchFraction must be within (0,1]");
        }
        if (scenario != null) {
            scenario.validate(patternName);
        }
        return this;
    }

    public double matchFractionOr(double fallback) {
        return matchFraction != null ? matchFraction : fallback;
    }

    public record Condition(String kpi, Timeframe timeframe, List<TrendDirection> directions) {

        public Condition {
            directions = directions == null ? List.of() : List.copyOf(directions);
        }

        public String describe() {
            return kpi + " " + timeframe + " " + directions;
        }
    }

    public record Scenario(
            String category,
            String title,
            String description,
            double urgency,
            double impact,
            double feasibility,
            List<String> actionItems
    ) {

        public Scenario {
            actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
        }

        void validate(String patternName) {
            if (category == null || category.isBlank() || title == null || title.isBlank()) {
                throw new ConfigurationException(patternName, "scenario needs a category and a title");
            }
            for (double value : new double[] {urgency, impact, feasibility}) {
                if (value < 0d || value > 1d) {
                    throw new ConfigurationException(patternName, "scenario scores must be within [0,1]");
                }
            }
        }
    }
}
