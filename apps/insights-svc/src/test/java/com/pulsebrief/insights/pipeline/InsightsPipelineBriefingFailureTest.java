package com.pulsebrief.insights.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.pulsebrief.insights.SyntheticSeries;
import com.pulsebrief.insights.briefing.BriefingService;
import com.pulsebrief.insights.briefing.ContentScorer;
import com.pulsebrief.insights.feed.KpiFeed;
import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.KpiSeries;
import com.pulsebrief.insights.model.SamplingFrequency;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

@SpringBootTest
class InsightsPipelineBriefingFailureTest {

    @Autowired
    private InsightsPipeline pipeline;

    @Autowired
    private KpiFeed kpiFeed;

    @Autowired
    private BriefingService briefingService;

    @MockBean
    private ContentScorer contentScorer;

    @Test
    void failedAssemblyStillStoresABriefingThatReportsIt() {
        KpiSeries revenue = SyntheticSeries.daily("revenue", SyntheticSeries.growth(90, 1000, 0.02, 0.01, 41L));
        kpiFeed.ingest("briefing-failure", "revenue", SamplingFrequency.DAILY, revenue.points());
        when(contentScorer.score(anyString(), any(BriefingType.class), anyList()))
                .thenThrow(new IllegalStateException("engagement store unavailable"));

        InsightsRunResult result = pipeline.run("briefing-failure", BriefingType.EVENING, SyntheticSeries.day(89));

        assertThat(result.issues()).extracting(DataQualityIssue::subject).contains("briefing");
        assertThat(result.trends()).isNotEmpty();
        assertThat(result.briefing().sections()).isEmpty();
        assertThat(result.briefing().dataQualityNote()).contains("briefing");
        assertThat(briefingService.latest("briefing-failure").id()).isEqualTo(result.briefing().id());
    }
}
