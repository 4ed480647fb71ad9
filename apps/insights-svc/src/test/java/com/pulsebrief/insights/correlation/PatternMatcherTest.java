package com.pulsebrief.insights.correlation;

import static org.assertj.core.api.Assertions.assertThat;

import com.pulsebrief.insights.Fixtures;
import com.pulsebrief.insights.model.PatternMatch;
import com.pulsebrief.insights.model.Timeframe;
import com.pulsebrief.insights.model.Trend;
import com.pulsebrief.insights.model.TrendDirection;
import com.pulsebrief.insights.rules.PatternDefinition;
import com.pulsebrief.insights.rules.PatternDefinition.Condition;
import com.pulsebrief.insights.trend.TrendService.TrendReport;
import java.util.List;
import org.junit.jupiter.api.Test;

class PatternMatcherTest {

    private final PatternMatcher matcher = new PatternMatcher(0.75d);

    private final PatternDefinition stalledGrowth = new PatternDefinition("stalled_growth", "Growth has stalled", null,
            List.of(
                    new Condition("mrr", Timeframe.MOM, List.of(TrendDirection.FLAT, TrendDirection.DOWN)),
                    new Condition("signups", Timeframe.MOM, List.of(TrendDirection.FLAT, TrendDirection.DOWN)),
                    new Condition("activation", Timeframe.MOM, List.of(TrendDirection.DOWN)),
                    new Condition("cac", Timeframe.MOM, List.of(TrendDirection.UP))),
            null);

    private TrendReport report(Trend... trends) {
        return new TrendReport(List.of(trends), List.of());
    }

    @Test
    void matchesWhenThreeOfFourConditionsHold() {
        TrendReport trends = report(
                Fixtures.trend("mrr", Timeframe.MOM, TrendDirection.FLAT),
                Fixtures.trend("signups", Timeframe.MOM, TrendDirection.DOWN),
                Fixtures.trend("activation", Timeframe.MOM, TrendDirection.DOWN),
                Fixtures.trend("cac", Timeframe.MOM, TrendDirection.FLAT));

        PatternMatch match = matcher.match(List.of(stalledGrowth), trends).get(0);

        assertThat(match.matched()).isTrue();
        assertThat(match.fractionSatisfied()).isEqualTo(0.75d);
        assertThat(match.unmetConditions()).singleElement().asString().startsWith("cac");
    }

    @Test
    void missingKpiCountsAsUnmet() {
        TrendReport trends = report(
                Fixtures.trend("mrr", Timeframe.MOM, TrendDirection.FLAT),
                Fixtures.trend("signups", Timeframe.MOM, TrendDirection.DOWN));

        PatternMatch match = matcher.match(List.of(stalledGrowth), trends).get(0);

        assertThat(match.matched()).isFalse();
        assertThat(match.fractionSatisfied()).isEqualTo(0.5d);
    }

    @Test
    void patternThresholdOverridesDefault() {
        PatternDefinition strict = new PatternDefinition("strict", "All must hold", 1.0d, stalledGrowth.conditions(), null);
        TrendReport trends = report(
                Fixtures.trend("mrr", Timeframe.MOM, TrendDirection.FLAT),
                Fixtures.trend("signups", Timeframe.MOM, TrendDirection.DOWN),
                Fixtures.trend("activation", Timeframe.MOM, TrendDirection.DOWN),
                Fixtures.trend("cac", Timeframe.MOM, TrendDirection.FLAT));

        assertThat(matcher.match(List.of(strict), trends).get(0).matched()).isFalse();
    }

    @Test
    void malformedPatternIsSkipped() {
        PatternDefinition empty = new PatternDefinition("empty", "No conditions", null, List.of(), null);

        List<PatternMatch> matches = matcher.match(List.of(empty, stalledGrowth), report());

        assertThat(matches).extracting(PatternMatch::patternName).containsExactly("stalled_growth");
    }
}
