package com.pulsebrief.insights.anomaly;

import static org.assertj.core.api.Assertions.assertThat;

import com.pulsebrief.insights.SyntheticSeries;
import com.pulsebrief.insights.anomaly.AnomalyBacktester.BacktestReport;
import com.pulsebrief.insights.anomaly.AnomalyBacktester.Injection;
import com.pulsebrief.insights.anomaly.AnomalyBacktester.Kind;
import com.pulsebrief.insights.config.InsightsProperties;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnomalyBacktesterTest {

    private final InsightsProperties properties = InsightsProperties.defaults();
    private final SeasonalModelCache cache = AnomalyFixtures.cache(properties);
    private final AnomalyBacktester backtester = new AnomalyBacktester(
            AnomalyFixtures.detector(properties, cache), new SeriesPreparer(properties), cache, properties);

    @Test
    void injectedSpikesDropsAndLevelShiftMeetTargets() {
        double[] clean = SyntheticSeries.weeklySeasonal(168, 1000, 0.08, 0.02, 2024L);
        List<Injection> injections = List.of(
                new Injection(80, Kind.SPIKE, 0.5),
                new Injection(90, Kind.DROP, 0.4),
                new Injection(100, Kind.SPIKE, 0.5),
                new Injection(110, Kind.DROP, 0.4),
                new Injection(120, Kind.SPIKE, 0.5),
                new Injection(140, Kind.LEVEL_SHIFT, 0.4));

        BacktestReport report = backtester.run(SyntheticSeries.daily("revenue", clean), injections, 70, 0.6d);

        assertThat(report.recall()).isGreaterThanOrEqualTo(properties.detection().backtestMinRecall());
        assertThat(report.falsePositiveRate()).isLessThanOrEqualTo(properties.detection().backtestMaxFalsePositiveRate());
        assertThat(report.meetsTargets()).isTrue();
        assertThat(report.truePositives() + report.falseNegatives()).isEqualTo(6);
    }

    @Test
    void backtestLeavesNoCachedModelsBehind() {
        double[] clean = SyntheticSeries.weeklySeasonal(60, 200, 0.05, 0.02, 9L);

        backtester.run(SyntheticSeries.daily("signups", clean), List.of(new Injection(50, Kind.SPIKE, 0.6)), 30, 0.5d);

        assertThat(cache.size()).isZero();
    }
}
