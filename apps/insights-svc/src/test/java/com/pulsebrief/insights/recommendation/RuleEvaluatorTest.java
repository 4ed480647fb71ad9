package com.pulsebrief.insights.recommendation;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsebrief.insights.Fixtures;
import com.pulsebrief.insights.model.Acceleration;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.FeedbackAction;
import com.pulsebrief.insights.model.PriorityLevel;
import com.pulsebrief.insights.model.Timeframe;
import com.pulsebrief.insights.model.TrendDirection;
import com.pulsebrief.insights.rules.Operator;
import com.pulsebrief.insights.rules.RuleDefinition;
import com.pulsebrief.insights.rules.RuleTable;
import com.pulsebrief.insights.rules.RuleTableLoader;
import com.pulsebrief.insights.trend.TrendService.TrendReport;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class RuleEvaluatorTest {

    private static final Instant AS_OF = Instant.parse("2024-06-01T06:00:00Z");

    private final CalibrationStore calibration = new CalibrationStore(0.5d, 1.2d, 0.1d);
    private final RuleEvaluator evaluator = new RuleEvaluator(calibration, 0.95d);
    private final RuleTable shipped = new RuleTableLoader(new ObjectMapper(), new DefaultResourceLoader(), Clock.systemUTC())
            .load("classpath:insights/rule-table.json");

    private RecommendationInput input(Map<String, Double> latest, TrendReport trends) {
        return new RecommendationInput("tenant-a", AS_OF, latest, trends, List.of(), null, List.of());
    }

    @Test
    void shortRunwayFiresPinnedCriticalRule() {
        List<DataQualityIssue> issues = new ArrayList<>();

        List<RecommendationCandidate> candidates =
                evaluator.evaluate(shipped, input(Map.of("runway_months", 4.5d), null), issues);

        RecommendationCandidate critical = candidates.stream()
                .filter(candidate -> candidate.sourceKey().equals("runway_critical"))
                .findFirst().orElseThrow();
        assertThat(critical.level()).isEqualTo(PriorityLevel.CRITICAL);
        assertThat(critical.pinned()).isTrue();
        assertThat(critical.title()).isEqualTo("Runway is below 6 months");
        assertThat(critical.description()).startsWith("Runway is 4.5 months against a 6-month floor.");
        assertThat(critical.confidence()).isEqualTo(0.95d);
        assertThat(candidates).extracting(RecommendationCandidate::sourceKey).contains("runway_watch");
        assertThat(issues).isEmpty();
    }

    @Test
    void healthyRunwayFiresNothing() {
        List<RecommendationCandidate> candidates =
                evaluator.evaluate(shipped, input(Map.of("runway_months", 18d), null), new ArrayList<>());

        assertThat(candidates).isEmpty();
    }

    @Test
    void trendRuleNeedsDirectionAndAcceleration() {
        TrendReport accelerating = new TrendReport(List.of(
                Fixtures.trend("churn_rate", Timeframe.MOM, TrendDirection.UP, Acceleration.ACCELERATING)), List.of());
        TrendReport steady = new TrendReport(List.of(
                Fixtures.trend("churn_rate", Timeframe.MOM, TrendDirection.UP, Acceleration.STEADY)), List.of());

        assertThat(evaluator.evaluate(shipped, input(Map.of(), accelerating), new ArrayList<>()))
                .extracting(RecommendationCandidate::sourceKey).containsExactly("churn_accelerating");
        assertThat(evaluator.evaluate(shipped, input(Map.of(), steady), new ArrayList<>())).isEmpty();
    }

    @Test
    void malformedRuleIsReportedAndOthersStillRun() {
        RuleDefinition broken = new RuleDefinition("broken", "runway", PriorityLevel.HIGH, RuleDefinition.Kind.THRESHOLD,
                "runway_months", Operator.LT, null, null, null, null, 0.5d, 0.5d, 0.5d, "t", "d", List.of());
        RuleDefinition valid = new RuleDefinition("valid", "runway", PriorityLevel.HIGH, RuleDefinition.Kind.THRESHOLD,
                "runway_months", Operator.LT, 12d, null, null, null, 0.5d, 0.5d, 0.5d, "Runway under {threshold}", "d",
                List.of());
        RuleTable table = new RuleTable("test", AS_OF, List.of(broken, valid), List.of());
        List<DataQualityIssue> issues = new ArrayList<>();

        List<RecommendationCandidate> candidates = evaluator.evaluate(table, input(Map.of("runway_months", 8d), null), issues);

        assertThat(candidates).extracting(RecommendationCandidate::sourceKey).containsExactly("valid");
        assertThat(issues).singleElement().extracting(DataQualityIssue::subject).isEqualTo("broken");
    }

    @Test
    void calibrationScalesRuleConfidence() {
        calibration.record("tenant-a", "runway_watch", FeedbackAction.DISMISSED);

        RecommendationCandidate watch = evaluator.evaluate(shipped, input(Map.of("runway_months", 9d), null),
                new ArrayList<>()).get(0);

        assertThat(watch.sourceKey()).isEqualTo("runway_watch");
        assertThat(watch.confidence()).isLessThan(0.95d);
    }

    @Test
    void formatsValuesWithoutTrailingZeros() {
        assertThat(RuleEvaluator.format(6d)).isEqualTo("6");
        assertThat(RuleEvaluator.format(0.456d)).isEqualTo("0.46");
    }
}
