package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.PatternMatch;
import com.pulsebrief.insights.model.RecommendationSource;
import com.pulsebrief.insights.rules.PatternDefinition;
import com.pulsebrief.insights.rules.RuleTable;
import com.pulsebrief.insights.stats.Statistics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns matched patterns that define a scenario into candidates with moderate confidence:
 * base confidence times match fraction times the learned calibration factor.
 */
@Component
public class PatternCandidateGenerator {

    private final CalibrationStore calibration;
    private final double patternConfidence;

    @Autowired

    public PatternCandidateGenerator(CalibrationStore calibration, InsightsProperties properties) {
        this(calibration, properties.recommendation().patternConfidence());
    }

    PatternCandidateGenerator(CalibrationStore calibration, double patternConfidence) {
        this.calibration = calibration;
        this.patternConfidence = patternConfidence;
    }

    public List<RecommendationCandidate> generate(RuleTable table, RecommendationInput input) {
        Map<String, PatternDefinition> byName = table.patterns().stream()
                .filter(pattern -> pattern.name() != null)
                .collect(Collectors.toMap(PatternDefinition::name, Function.identity(), (first, second) -> first));
        List<RecommendationCandidate> candidates = new ArrayList<>();
        for (PatternMatch match : input.patternMatches()) {
            PatternDefinition pattern = byName.get(match.patternName());
            if (!match.matched() || pattern == null || pattern.scenario() == null) {
                continue;
            }
            PatternDefinition.Scenario scenario = pattern.scenario();
            double confidence = Statistics.clamp(
                    patternConfidence * match.fractionSatisfied() * calibration.factorFor(input.tenantId(), pattern.name()),
                    0d, 1d);
            String description = scenario.description() != null ? scenario.description() : pattern.description();
            candidates.add(new RecommendationCandidate(
                    scenario.category(),
                    scenario.title(),
                    description + " Conditions met: " + String.join("; ", match.satisfiedConditions()) + ".",
                    scenario.urgency(),
                    scenario.impact(),
                    scenario.feasibility(),
                    confidence,
                    null,
                    scenario.actionItems(),
                    RecommendationSource.PATTERN,
                    pattern.name(),
                    false));
        }
        return candidates;
    }
}
