package com.pulsebrief.insights.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.when;

import com.pulsebrief.insights.SyntheticSeries;
import com.pulsebrief.insights.feed.KpiFeed;
import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.KpiSeries;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.SamplingFrequency;
import com.pulsebrief.insights.trend.TrendService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

@SpringBootTest
class InsightsPipelineStageFailureTest {

    @Autowired
    private InsightsPipeline pipeline;

    @Autowired
    private KpiFeed kpiFeed;

    @MockBean
    private TrendService trendService;

    @Test
    void failingStageIsRecordedAndTheRunContinues() {
        KpiSeries revenue = SyntheticSeries.daily("revenue", SyntheticSeries.growth(90, 1000, 0.02, 0.01, 31L));
        kpiFeed.ingest("stage-failure", "revenue", SamplingFrequency.DAILY, revenue.points());
        kpiFeed.putDerivedMetric("stage-failure", "runway_months", 9d);
        when(trendService.analyzeAll(anyMap())).thenThrow(new IllegalStateException("trend store offline"));

        InsightsRunResult result = pipeline.run("stage-failure", BriefingType.MORNING, SyntheticSeries.day(89));

        assertThat(result.trends()).isEmpty();
        assertThat(result.issues()).extracting(DataQualityIssue::subject).contains("trend_analysis");
        assertThat(result.recommendations()).extracting(Recommendation::sourceKey).contains("runway_watch");
        assertThat(result.briefing().dataQualityNote()).contains("trend_analysis");
    }
}
