package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.error.ConfigurationException;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.PriorityLevel;
import com.pulsebrief.insights.model.RecommendationSource;
import com.pulsebrief.insights.model.Trend;
import com.pulsebrief.insights.rules.RuleDefinition;
import com.pulsebrief.insights.rules.RuleTable;
import com.pulsebrief.insights.stats.Statistics;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Evaluates every rule of the captured table. A malformed rule is skipped and reported; it
 * never stops the remaining rules.
 */
@Component
public class RuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private final CalibrationStore calibration;
    private final double ruleConfidence;

    @Autowired

    public RuleEvaluator(CalibrationStore calibration, InsightsProperties properties) {
        this(calibration, properties.recommendation().ruleConfidence());
    }

    RuleEvaluator(CalibrationStore calibration, double ruleConfidence) {
        this.calibration = calibration;
        this.ruleConfidence = ruleConfidence;
    }

    public List<RecommendationCandidate> evaluate(RuleTable table, RecommendationInput input, List<DataQualityIssue> issues) {
        List<RecommendationCandidate> candidates = new ArrayList<>();
        for (RuleDefinition rule : table.rules()) {
            try {
                evaluate(rule.validate(), input).ifPresent(candidates::add);
            } catch (ConfigurationException ex) {
                log.warn("Rule evaluation: skipping rule '{}' (table {}): {}", ex.subject(), table.version(), ex.getMessage());
                issues.add(new DataQualityIssue(ex.subject(), "rule_evaluation", ex.getMessage()));
            }
        }
        return candidates;
    }

    Optional<RecommendationCandidate> evaluate(RuleDefinition rule, RecommendationInput input) {
        Double value = input.latestValues().get(rule.metric());
        boolean fired = switch (rule.kind()) {
            case THRESHOLD -> value != null && rule.operator().test(value, rule.threshold());
            case TREND -> trendHolds(rule, input);
        };
        if (!fired) {
            if (value == null && rule.kind() == RuleDefinition.Kind.THRESHOLD) {
                log.debug("Rule evaluation: rule={} has no value for metric {}", rule.id(), rule.metric());
            }
            return Optional.empty();
        }
        double confidence = Statistics.clamp(
                ruleConfidence * calibration.factorFor(input.tenantId(), rule.id()), 0d, 1d);
        return Optional.of(new RecommendationCandidate(
                rule.category(),
                fill(rule.titleTemplate(), rule, value),
                fill(rule.descriptionTemplate(), rule, value),
                rule.urgency(),
                rule.impact(),
                rule.feasibility(),
                confidence,
                rule.level(),
                rule.actionItems(),
                RecommendationSource.RULE,
                rule.id(),
                rule.level() == PriorityLevel.CRITICAL));
    }

    private boolean trendHolds(RuleDefinition rule, RecommendationInput input) {
        Trend trend = input.trends().find(rule.metric(), rule.timeframe());
        if (trend == null || trend.indeterminate() || trend.direction() != rule.direction()) {
            return false;
        }
        return rule.acceleration() == null || trend.acceleration() == rule.acceleration();
    }

    static String fill(String template, RuleDefinition rule, Double value) {
        if (template == null) {
            return "";
        }
        return template
                .replace("{metric}", rule.metric())
                .replace("{value}", value == null ? "n/a" : format(value))
                .replace("{threshold}", rule.threshold() == null ? "n/a" : format(rule.threshold()));
    }

    static String format(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }
}
