package com.pulsebrief.insights.rules;

import com.pulsebrief.insights.error.ConfigurationException;
import com.pulsebrief.insights.model.Acceleration;
import com.pulsebrief.insights.model.PriorityLevel;
import com.pulsebrief.insights.model.Timeframe;
import com.pulsebrief.insights.model.TrendDirection;
import java.util.List;

/**
 * A business-critical condition. THRESHOLD rules compare the latest value of
 * {@code metric}; TREND rules check the direction (and optionally acceleration) of the
 * metric's trend over {@code timeframe}.
 */
public record RuleDefinition(
        String id,
        String category,
        PriorityLevel level,
        Kind kind,
        String metric,
        Operator operator,
        Double threshold,
        Timeframe timeframe,
        TrendDirection direction,
        Acceleration acceleration,
        double urgency,
        double impact,
        double feasibility,
        String titleTemplate,
        String descriptionTemplate,
        List<String> actionItems
) {

    public enum Kind {
        THRESHOLD,
        TREND
    }

    public RuleDefinition {
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
    }

    /**
     * @throws ConfigurationException when a field the rule kind needs is missing or out of
     *                                range
     */
    public RuleDefinition validate() {
        String ruleId = id == null ? "<unnamed rule>" : id;
        if (id == null || id.isBlank()) {
            throw new ConfigurationException(ruleId, "rule id is required");
        }
        if (kind == null || metric == null || metric.isBlank() || category == null || level == null) {
            throw new ConfigurationException(ruleId, "kind, metric, category and level are required");
        }
        if (kind == Kind.THRESHOLD && (operator == null || threshold == null)) {
            throw new ConfigurationException(ruleId, "threshold rules need an operator and a threshold");
        }
        if (kind == Kind.TREND && (timeframe == null || direction == null)) {
            throw new ConfigurationException(ruleId, "trend rules need a timeframe and a direction");
        }
        for (double value : new double[] {urgency, impact, feasibility}) {
            if (value < 0d || value > 1d) {
                throw new ConfigurationException(ruleId, "urgency, impact and feasibility must be within [0,1]");
            }
        }
        if (titleTemplate == null || titleTemplate.isBlank()) {
            throw new ConfigurationException(ruleId, "title template is required");
        }
        return this;
    }
}
