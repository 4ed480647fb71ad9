package com.pulsebrief.insights.anomaly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.pulsebrief.insights.SyntheticSeries;
import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.AnomalyDirection;
import com.pulsebrief.insights.model.DetectionMethod;
import com.pulsebrief.insights.model.FeedbackAction;
import com.pulsebrief.insights.model.FounderProfile;
import com.pulsebrief.insights.model.KpiPoint;
import com.pulsebrief.insights.model.KpiSeries;
import com.pulsebrief.insights.model.SamplingFrequency;
import com.pulsebrief.insights.model.SensitivityProfile;
import com.pulsebrief.insights.model.Severity;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnomalyDetectionServiceTest {

    private final InsightsProperties properties = InsightsProperties.defaults();
    private final SeriesPreparer preparer = new SeriesPreparer(properties);
    private final AdaptiveThresholdStore thresholds = new AdaptiveThresholdStore(properties);
    private final AnomalyDetectionService service = new AnomalyDetectionService(
            AnomalyFixtures.detector(properties, AnomalyFixtures.cache(properties)), thresholds, properties);

    @Test
    void flagsDayEightyFiveDropAsCriticalAndDown() {
        double[] values = SyntheticSeries.growth(90, 1000, 0.02, 0.005, 7L);
        for (int i = 84; i < values.length; i++) {
            values[i] *= 0.6;
        }
        Instant asOf = SyntheticSeries.day(89);
        PreparedSeries series = preparer.prepare(SyntheticSeries.daily("revenue", values), asOf);

        List<Anomaly> anomalies = service.detectSeries("tenant-a", series, CrossKpiSnapshot.empty(), 0.1d, 0.5d, asOf);

        assertThat(anomalies)
                .filteredOn(anomaly -> anomaly.timestamp().equals(SyntheticSeries.day(84)))
                .singleElement()
                .satisfies(anomaly -> {
                    assertThat(anomaly.severity()).isEqualTo(Severity.CRITICAL);
                    assertThat(anomaly.direction()).isEqualTo(AnomalyDirection.DOWN);
                    assertThat(anomaly.magnitude()).isLessThan(-0.3d);
                    assertThat(anomaly.contributingMethods()).contains(DetectionMethod.STATISTICAL, DetectionMethod.SEASONAL);
                    assertThat(anomaly.explanation()).contains("revenue").contains("below");
                });
    }

    @Test
    void singleDayFortyPercentDropIsCriticalAndDown() {
        double[] values = SyntheticSeries.growth(90, 1000, 0.02, 0.005, 7L);
        values[84] *= 0.6;
        Instant asOf = SyntheticSeries.day(89);
        PreparedSeries series = preparer.prepare(SyntheticSeries.daily("revenue", values), asOf);

        List<Anomaly> anomalies = service.detectSeries("tenant-a", series, CrossKpiSnapshot.empty(), 0.1d, 0.5d, asOf);

        assertThat(anomalies)
                .filteredOn(anomaly -> anomaly.timestamp().equals(SyntheticSeries.day(84)))
                .singleElement()
                .satisfies(anomaly -> {
                    assertThat(anomaly.severity()).isEqualTo(Severity.CRITICAL);
                    assertThat(anomaly.direction()).isEqualTo(AnomalyDirection.DOWN);
                    assertThat(anomaly.score()).isGreaterThan(0.8d);
                });
    }

    @Test
    void olderAnomaliesAreKeptInHistoryButNotReported() {
        double[] values = SyntheticSeries.growth(120, 1000, 0.02, 0.005, 7L);
        values[100] *= 1.8;
        Instant asOf = SyntheticSeries.day(119);
        PreparedSeries series = preparer.prepare(SyntheticSeries.daily("leads", values), asOf);

        AnomalyReport report = service.detect("tenant-a", Map.of("leads", series), null, asOf);

        assertThat(report.history())
                .filteredOn(anomaly -> anomaly.timestamp().equals(SyntheticSeries.day(100)))
                .singleElement()
                .satisfies(anomaly -> assertThat(anomaly.direction()).isEqualTo(AnomalyDirection.UP));
        assertThat(report.anomalies()).noneMatch(anomaly -> anomaly.timestamp().isBefore(SyntheticSeries.day(113)));
        assertThat(report.history()).containsAll(report.anomalies());
    }

    @Test
    void quietSeriesProducesNoAnomalies() {
        double[] values = SyntheticSeries.weeklySeasonal(60, 500, 0.1, 0.001, 11L);
        Instant asOf = SyntheticSeries.day(59);
        PreparedSeries series = preparer.prepare(SyntheticSeries.daily("signups", values), asOf);

        List<Anomaly> anomalies = service.detectSeries("tenant-a", series, CrossKpiSnapshot.empty(), 0.1d, 0.6d, asOf);

        assertThat(anomalies).isEmpty();
    }

    @Test
    void failingKpiIsReportedWithoutStoppingOthers() {
        AnomalyDetector detector = mock(AnomalyDetector.class);
        when(detector.detect(argThat(context -> context != null && context.series().kpiName().equals("churn")), anyDouble()))
                .thenThrow(new IllegalStateException("detector state corrupted"));
        AnomalyDetectionService isolating = new AnomalyDetectionService(detector, thresholds, properties);
        Instant asOf = SyntheticSeries.day(39);
        PreparedSeries mrr = preparer.prepare(SyntheticSeries.daily("mrr", SyntheticSeries.growth(40, 100, 0.02, 0.01, 3L)), asOf);
        PreparedSeries churn = preparer.prepare(SyntheticSeries.daily("churn", SyntheticSeries.growth(40, 5, 0.0, 0.01, 4L)), asOf);

        AnomalyReport report = isolating.detect("tenant-a", Map.of("mrr", mrr, "churn", churn),
                FounderProfile.defaultFor("tenant-a"), asOf);

        assertThat(report.issues()).extracting(issue -> issue.subject()).containsExactly("churn");
        verify(detector, atLeastOnce()).detect(argThat(context -> context != null && context.series().kpiName().equals("mrr")), anyDouble());
    }

    @Test
    void staleSeriesIsFlaggedAsDataQualityIssue() {
        double[] values = SyntheticSeries.growth(40, 100, 0.02, 0.01, 5L);
        Instant asOf = SyntheticSeries.day(39 + 10);
        PreparedSeries series = preparer.prepare(SyntheticSeries.daily("mrr", values), asOf);

        AnomalyReport report = service.detect("tenant-a", Map.of("mrr", series), null, asOf);

        assertThat(series.stale()).isTrue();
        assertThat(report.issues()).singleElement()
                .satisfies(issue -> assertThat(issue.message()).contains("confidence reduced"));
    }

    @Test
    void thresholdCombinesProfileStaticTableAndFeedback() {
        FounderProfile aggressive = new FounderProfile("tenant-a", null, null, List.of(),
                SensitivityProfile.AGGRESSIVE, null, null);
        assertThat(service.thresholdFor("tenant-a", "mrr", aggressive)).isEqualTo(0.4d);

        thresholds.recordFeedback("tenant-a", "mrr", FeedbackAction.DISMISSED);
        thresholds.recordFeedback("tenant-a", "mrr", FeedbackAction.DISMISSED);

        assertThat(service.thresholdFor("tenant-a", "mrr", aggressive)).isCloseTo(0.44d, within(1e-9));
        assertThat(service.thresholdFor("tenant-b", "mrr", aggressive)).isEqualTo(0.4d);
    }

    @Test
    void longGapTruncatesHistoryInsteadOfInventingValues() {
        List<KpiPoint> points = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            if (i >= 10 && i < 16) {
                continue;
            }
            points.add(new KpiPoint(SyntheticSeries.day(i), 100d + i));
        }
        points.add(new KpiPoint(SyntheticSeries.day(30), null));

        PreparedSeries series = preparer.prepare(new KpiSeries("cash", points, SamplingFrequency.DAILY),
                SyntheticSeries.day(29));

        assertThat(series.truncated()).isTrue();
        assertThat(series.origin()).isEqualTo(SyntheticSeries.day(16));
        assertThat(series.length()).isEqualTo(14);
        assertThat(series.imputedCount()).isZero();
    }

    @Test
    void shortGapIsInterpolatedAndFlagged() {
        List<KpiPoint> points = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            if (i == 4 || i == 5) {
                continue;
            }
            points.add(new KpiPoint(SyntheticSeries.day(i), 10d * i));
        }

        PreparedSeries series = preparer.prepare(new KpiSeries("cash", points, SamplingFrequency.DAILY),
                SyntheticSeries.day(9));

        assertThat(series.length()).isEqualTo(10);
        assertThat(series.valueAt(4)).isEqualTo(40d);
        assertThat(series.valueAt(5)).isEqualTo(50d);
        assertThat(series.imputed()[4]).isTrue();
        assertThat(series.qualityFactor(4)).isEqualTo(0.6d);
    }
}
