package com.pulsebrief.insights.recommendation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsebrief.insights.Fixtures;
import com.pulsebrief.insights.ai.EnrichmentContext;
import com.pulsebrief.insights.ai.TemplateEnrichmentProvider;
import com.pulsebrief.insights.model.PatternMatch;
import com.pulsebrief.insights.model.PriorityLevel;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RecommendationSource;
import com.pulsebrief.insights.model.Timeframe;
import com.pulsebrief.insights.model.TrendDirection;
import com.pulsebrief.insights.rules.RuleTable;
import com.pulsebrief.insights.rules.RuleTableLoader;
import com.pulsebrief.insights.trend.TrendService.TrendReport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class RecommendationEngineTest {

    private static final Instant AS_OF = Instant.parse("2024-06-01T06:00:00Z");

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final CalibrationStore calibration = new CalibrationStore(0.5d, 1.2d, 0.1d);
    private final RecommendationEngine engine = new RecommendationEngine(
            new RuleEvaluator(calibration, 0.95d),
            new PatternCandidateGenerator(calibration, 0.6d),
            new PriorityScorer(0.35d, 0.30d, 0.15d, 0.20d),
            new RecommendationRanker(2, 5),
            new RecommendationEnricher(new TemplateEnrichmentProvider(), executor, 3, Duration.ofSeconds(5)));
    private final RuleTable table = new RuleTableLoader(new ObjectMapper(), new DefaultResourceLoader(), Clock.systemUTC())
            .load("classpath:insights/rule-table.json");
    private final EnrichmentContext context = new EnrichmentContext("tenant-a", "seed", List.of("runway"),
            List.of("Runway dropped after a burn spike."));

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private RecommendationInput input(Map<String, Double> latest, List<PatternMatch> matches, RecommendationSignals signals) {
        return new RecommendationInput("tenant-a", AS_OF, latest, new TrendReport(List.of(), List.of()), matches, signals,
                List.of());
    }

    @Test
    void criticalRunwayLeadsTheList() {
        RecommendationEngine.RecommendationOutcome outcome =
                engine.recommend(table, input(Map.of("runway_months", 4.5d), List.of(), null), context);

        Recommendation top = outcome.recommendations().get(0);
        assertThat(top.sourceKey()).isEqualTo("runway_critical");
        assertThat(top.level()).isEqualTo(PriorityLevel.CRITICAL);
        assertThat(top.pinned()).isTrue();
        assertThat(top.priorityScore()).isCloseTo(94.5d, within(1e-9));
        assertThat(top.source()).isEqualTo(RecommendationSource.ENRICHED);
        assertThat(top.rationale()).isNotBlank();
        assertThat(outcome.enrichmentFailed()).isZero();
    }

    @Test
    void identifiersAreStableAcrossReruns() {
        RecommendationInput input = input(Map.of("runway_months", 4.5d), List.of(), null);

        List<String> first = engine.recommend(table, input, context).recommendations().stream().map(Recommendation::id).toList();
        List<String> second = engine.recommend(table, input, context).recommendations().stream().map(Recommendation::id).toList();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void matchedPatternYieldsScoredCandidateWithDerivedLevel() {
        TrendReport trends = new TrendReport(List.of(
                Fixtures.trend("revenue", Timeframe.MOM, TrendDirection.UP),
                Fixtures.trend("cac", Timeframe.MOM, TrendDirection.FLAT)), List.of());
        PatternMatch match = new PatternMatch("growth_efficiency", "Revenue growing", 1d, true,
                List.of("revenue MOM [UP]", "cac MOM [DOWN, FLAT]", "ltv_cac_ratio MOM [UP, FLAT]"), List.of());
        RecommendationInput input = new RecommendationInput("tenant-a", AS_OF, Map.of(), trends, List.of(match), null,
                List.of());

        List<Recommendation> recommendations = engine.recommend(table, input, context).recommendations();

        assertThat(recommendations).singleElement().satisfies(recommendation -> {
            assertThat(recommendation.sourceKey()).isEqualTo("growth_efficiency");
            assertThat(recommendation.confidence()).isCloseTo(0.6d, within(1e-9));
            assertThat(recommendation.pinned()).isFalse();
            assertThat(recommendation.level()).isNotNull();
        });
    }

    @Test
    void overdueTasksLowerFeasibility() {
        RecommendationCandidate candidate = new RecommendationCandidate("team", "Hire", "d", 0.5d, 0.5d, 0.8d, 0.9d,
                null, List.of(), RecommendationSource.RULE, "hire", false);

        RecommendationCandidate adjusted = engine.adjust(candidate, new RecommendationSignals(10, 0d));

        assertThat(adjusted.feasibility()).isCloseTo(0.5d, within(1e-9));
        assertThat(adjusted.urgency()).isEqualTo(0.5d);
    }

    @Test
    void negativeSentimentRaisesUrgencyOnlyForPeopleCategories() {
        RecommendationSignals gloomy = new RecommendationSignals(0, -0.6d);
        RecommendationCandidate team = new RecommendationCandidate("team", "Hire", "d", 0.5d, 0.5d, 0.8d, 0.9d,
                null, List.of(), RecommendationSource.RULE, "hire", false);
        RecommendationCandidate runway = new RecommendationCandidate("runway", "Raise", "d", 0.5d, 0.5d, 0.8d, 0.9d,
                null, List.of(), RecommendationSource.RULE, "raise", false);

        assertThat(engine.adjust(team, gloomy).urgency()).isCloseTo(0.6d, within(1e-9));
        assertThat(engine.adjust(runway, gloomy).urgency()).isEqualTo(0.5d);
    }
}
