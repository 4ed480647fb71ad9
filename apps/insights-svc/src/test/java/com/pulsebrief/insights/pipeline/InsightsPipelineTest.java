package com.pulsebrief.insights.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pulsebrief.insights.SyntheticSeries;
import com.pulsebrief.insights.briefing.BriefingService;
import com.pulsebrief.insights.feed.KpiFeed;
import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.ContentItem;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.KpiSeries;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RootCauseFinding;
import com.pulsebrief.insights.model.SamplingFrequency;
import java.time.Instant;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class InsightsPipelineTest {

    private static final Instant AS_OF = SyntheticSeries.day(119);

    @Autowired
    private InsightsPipeline pipeline;

    @Autowired
    private KpiFeed kpiFeed;

    @Autowired
    private InsightsRunRepository runRepository;

    @Autowired
    private BriefingService briefingService;

    private void ingest(String tenantId, KpiSeries series) {
        kpiFeed.ingest(tenantId, series.kpiName(), SamplingFrequency.DAILY, series.points());
    }

    @Test
    void shortRunwayProducesPinnedRecommendationInTheBriefing() {
        ingest("pipeline-healthy", SyntheticSeries.daily("revenue", SyntheticSeries.growth(120, 1000, 0.03, 0.01, 11L)));
        ingest("pipeline-healthy", SyntheticSeries.daily("signups", SyntheticSeries.growth(120, 50, 0.02, 0.05, 12L)));
        kpiFeed.putDerivedMetric("pipeline-healthy", "runway_months", 4.5d);

        InsightsRunResult result = pipeline.run("pipeline-healthy", BriefingType.MORNING, AS_OF);

        assertThat(result.kpiCount()).isEqualTo(2);
        assertThat(result.ruleTableVersion()).isEqualTo("2024.1");
        Recommendation top = result.recommendations().get(0);
        assertThat(top.sourceKey()).isEqualTo("runway_critical");
        assertThat(top.pinned()).isTrue();
        assertThat(result.briefing().items()).extracting(ContentItem::id).contains("recommendation:" + top.id());
        assertThat(result.trends()).isNotEmpty();
        assertThat(runRepository.findLatest("pipeline-healthy")).contains(result);
        assertThat(briefingService.latest("pipeline-healthy").id()).isEqualTo(result.briefing().id());
        assertThat(result.runId()).isEqualTo(InsightsPipeline.runIdFor("pipeline-healthy", BriefingType.MORNING, AS_OF));
    }

    @Test
    void currentAnomalyIsTracedToLeaderSpikeOutsideTheEvaluationWindow() {
        Random leaderNoise = new Random(31L);
        double[] leads = SyntheticSeries.generate(120, i -> 100 + 10 * leaderNoise.nextGaussian());
        leads[109] += 80;
        Random followerNoise = new Random(32L);
        double[] deals = SyntheticSeries.generate(120, i -> (i >= 10 ? leads[i - 10] : 100) + 2 * followerNoise.nextGaussian());
        ingest("pipeline-lagged", SyntheticSeries.daily("leads", leads));
        ingest("pipeline-lagged", SyntheticSeries.daily("deals", deals));

        InsightsRunResult result = pipeline.run("pipeline-lagged", BriefingType.MORNING, AS_OF);

        assertThat(result.dependencies().edges())
                .anySatisfy(edge -> {
                    assertThat(edge.sourceKpi()).isEqualTo("leads");
                    assertThat(edge.targetKpi()).isEqualTo("deals");
                    assertThat(edge.lag()).isEqualTo(10);
                });
        assertThat(result.anomalies()).extracting(Anomaly::kpiName).contains("deals");
        assertThat(result.rootCauses())
                .filteredOn(finding -> finding.kpiName().equals("deals") && finding.anomalyTimestamp().equals(AS_OF))
                .singleElement()
                .satisfies(finding -> assertThat(finding.candidates())
                        .extracting(RootCauseFinding.Candidate::kpiName).contains("leads"));
    }

    @Test
    void unusableSeriesDegradesTheRunButStillBriefs() {
        ingest("pipeline-degraded", SyntheticSeries.daily("revenue", SyntheticSeries.growth(60, 1000, 0.02, 0.01, 21L)));
        ingest("pipeline-degraded", SyntheticSeries.daily("signups", new double[] {42d}));

        InsightsRunResult result = pipeline.run("pipeline-degraded", BriefingType.EVENING, SyntheticSeries.day(59));

        assertThat(result.degraded()).isTrue();
        assertThat(result.kpiCount()).isEqualTo(1);
        assertThat(result.issues()).extracting(DataQualityIssue::subject).contains("signups");
        assertThat(result.briefing()).isNotNull();
        assertThat(result.briefing().dataQualityNote()).contains("signups");
    }

    @Test
    void tenantWithoutDataGetsAnExplainedEmptyBriefing() {
        InsightsRunResult result = pipeline.run("pipeline-empty", BriefingType.WEEKLY, AS_OF);

        assertThat(result.briefing().sections()).isEmpty();
        assertThat(result.briefing().dataQualityNote()).startsWith("No content was available");
        assertThat(result.anomalies()).isEmpty();
        assertThat(result.dependencies().edges()).isEmpty();
    }

    @Test
    void blankTenantIsRejected() {
        assertThatThrownBy(() -> pipeline.run(" ", BriefingType.MORNING, AS_OF))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
