package com.pulsebrief.insights.stats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class StatisticsTest {

    @Test
    void descriptiveStatisticsUseSampleVariance() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertThat(Statistics.mean(values)).isEqualTo(5d);
        assertThat(Statistics.variance(values)).isCloseTo(32d / 7d, within(1e-12));
        assertThat(Statistics.median(values)).isEqualTo(4.5d);
        assertThat(Statistics.medianAbsoluteDeviation(values)).isEqualTo(0.5d);
    }

    @Test
    void percentileInterpolatesBetweenRanks() {
        double[] values = {10, 20, 30, 40};

        assertThat(Statistics.percentile(values, 0)).isEqualTo(10d);
        assertThat(Statistics.percentile(values, 100)).isEqualTo(40d);
        assertThat(Statistics.percentile(values, 50)).isEqualTo(25d);
    }

    @Test
    void pearsonIsZeroForConstantSeries() {
        assertThat(Statistics.pearson(new double[]{1, 1, 1}, new double[]{1, 2, 3})).isZero();
        assertThat(Statistics.pearson(new double[]{1, 2, 3}, new double[]{2, 4, 6})).isCloseTo(1d, within(1e-12));
    }

    @Test
    void spearmanSharesRanksBetweenTies() {
        assertThat(Statistics.ranks(new double[]{3, 1, 3, 2})).containsExactly(3.5, 1, 3.5, 2);
        assertThat(Statistics.spearman(new double[]{1, 2, 3, 4}, new double[]{1, 4, 9, 16}))
                .isCloseTo(1d, within(1e-12));
    }

    @Test
    void laggedCorrelationAlignsLeaderWithLaterFollower() {
        double[] leader = {1, 5, 2, 8, 3, 9, 4, 7, 6, 0};
        double[] follower = new double[leader.length];
        for (int i = 2; i < leader.length; i++) {
            follower[i] = leader[i - 2];
        }

        assertThat(Statistics.laggedCorrelation(leader, follower, 2)).isCloseTo(1d, within(1e-9));
        assertThatThrownBy(() -> Statistics.laggedCorrelation(leader, follower, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pearsonRejectsMismatchedLengths() {
        assertThatThrownBy(() -> Statistics.pearson(new double[]{1, 2}, new double[]{1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
