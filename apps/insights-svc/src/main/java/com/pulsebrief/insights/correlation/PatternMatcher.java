package com.pulsebrief.insights.correlation;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.error.ConfigurationException;
import com.pulsebrief.insights.model.PatternMatch;
import com.pulsebrief.insights.model.Trend;
import com.pulsebrief.insights.rules.PatternDefinition;
import com.pulsebrief.insights.trend.TrendService;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Evaluates named multi-KPI patterns against this period's trend directions. A
 * condition on a KPI without a usable trend counts as unmet.
 */
@Component
public class PatternMatcher {

    private static final Logger log = LoggerFactory.getLogger(PatternMatcher.class);

    private final double defaultMatchFraction;

    @Autowired

    public PatternMatcher(InsightsProperties properties) {
        this(properties.correlation().defaultMatchFraction());
    }

    PatternMatcher(double defaultMatchFraction) {
        this.defaultMatchFraction = defaultMatchFraction;
    }

    public List<PatternMatch> match(List<PatternDefinition> patterns, TrendService.TrendReport trends) {
        List<PatternMatch> matches = new ArrayList<>();
        for (PatternDefinition pattern : patterns) {
            try {
                matches.add(evaluate(pattern.validate(), trends));
            } catch (ConfigurationException ex) {
                log.warn("Pattern matching: skipping pattern '{}': {}", ex.subject(), ex.getMessage());
            }
        }
        return matches;
    }

    PatternMatch evaluate(PatternDefinition pattern, TrendService.TrendReport trends) {
        List<String> satisfied = new ArrayList<>();
        List<String> unmet = new ArrayList<>();
        for (PatternDefinition.Condition condition : pattern.conditions()) {
            Trend trend = trends.find(condition.kpi(), condition.timeframe());
            boolean holds = trend != null && !trend.indeterminate() && condition.directions().contains(trend.direction());
            (holds ? satisfied : unmet).add(condition.describe());
        }
        double fraction = (double) satisfied.size() / pattern.conditions().size();
        boolean matched = fraction + 1e-9d >= pattern.matchFractionOr(defaultMatchFraction);
        return new PatternMatch(pattern.name(), pattern.description(), fraction, matched, satisfied, unmet);
    }
}
