package com.pulsebrief.insights.anomaly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.pulsebrief.insights.SyntheticSeries;
import com.pulsebrief.insights.error.ModelFitException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SeasonalModelCacheTest {

    private final SeriesPreparer preparer = new SeriesPreparer(3, 3);
    private final SeasonalModelCache cache = new SeasonalModelCache(new SeasonalModelFitter(), Duration.ofDays(7), 0.25d);

    private PreparedSeries series(int length) {
        double[] values = SyntheticSeries.generate(length, i -> 100 + 2 * i + 10 * Math.sin(2 * Math.PI * i / 7d));
        return preparer.prepare(SyntheticSeries.daily("orders", values), SyntheticSeries.day(length - 1));
    }

    @Test
    void fitRecoversTrendAndSeasonality() {
        PreparedSeries series = series(56);

        SeasonalModel model = new SeasonalModelFitter().fit(series, 49, Instant.EPOCH);

        assertThat(model.forecast(SyntheticSeries.day(50)))
                .isCloseTo(100 + 2 * 50 + 10 * Math.sin(2 * Math.PI * 50 / 7d), within(2d));
        assertThat(model.period()).isEqualTo(7);
    }

    @Test
    void tooShortHistoryCannotBeFitted() {
        PreparedSeries series = series(20);

        assertThatThrownBy(() -> new SeasonalModelFitter().fit(series, 15, Instant.EPOCH))
                .isInstanceOf(ModelFitException.class)
                .hasMessageContaining("16");
    }

    @Test
    void reusesModelUntilItAges() {
        PreparedSeries series = series(60);
        Instant now = SyntheticSeries.day(60);

        SeasonalModel first = cache.modelFor("t", series, 40, now);
        SeasonalModel again = cache.modelFor("t", series, 45, now.plus(Duration.ofDays(1)));
        SeasonalModel refit = cache.modelFor("t", series, 50, now.plus(Duration.ofDays(8)));

        assertThat(again).isSameAs(first);
        assertThat(refit).isNotSameAs(first);
        assertThat(refit.fittedPoints()).isEqualTo(50);
    }

    @Test
    void largeRollingErrorForcesRefit() {
        PreparedSeries series = series(60);
        Instant now = SyntheticSeries.day(60);
        SeasonalModel first = cache.modelFor("t", series, 40, now);

        for (int i = 41; i < 50; i++) {
            cache.recordError("t", "orders", SyntheticSeries.day(i), 100d, 200d);
        }

        assertThat(cache.rollingError("t", "orders")).isGreaterThan(0.25d);
        assertThat(cache.modelFor("t", series, 50, now)).isNotSameAs(first);
    }

    @Test
    void targetsInsideFittedRangeNeverSeeTheirOwnValue() {
        PreparedSeries series = series(60);
        Instant now = SyntheticSeries.day(60);
        cache.modelFor("t", series, 50, now);

        SeasonalModel earlier = cache.modelFor("t", series, 30, now);

        assertThat(earlier.fittedThrough()).isEqualTo(SyntheticSeries.day(29));
    }
}
