package com.pulsebrief.insights.recommendation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.pulsebrief.insights.model.PriorityLevel;
import org.junit.jupiter.api.Test;

class PriorityScorerTest {

    private final PriorityScorer scorer = new PriorityScorer(0.35d, 0.30d, 0.15d, 0.20d);

    @Test
    void weightsCombineIntoHundredPointScale() {
        assertThat(scorer.score(1d, 1d, 1d, 1d)).isCloseTo(100d, within(1e-9));
        assertThat(scorer.score(0d, 0d, 0d, 0d)).isZero();
        assertThat(scorer.score(1d, 1d, 0.7d, 0.95d)).isCloseTo(94.5d, within(1e-9));
    }

    @Test
    void inputsOutsideUnitRangeAreClamped() {
        assertThat(scorer.score(3d, 2d, 5d, 1.5d)).isCloseTo(100d, within(1e-9));
        assertThat(scorer.score(-1d, -2d, -0.5d, -3d)).isZero();
    }

    @Test
    void scoreNeverDecreasesWhenAnInputGrows() {
        double[] steps = {0d, 0.25d, 0.5d, 0.75d, 1d};
        for (double base : steps) {
            for (double higher : steps) {
                if (higher < base) {
                    continue;
                }
                assertThat(scorer.score(higher, base, base, base)).isGreaterThanOrEqualTo(scorer.score(base, base, base, base));
                assertThat(scorer.score(base, higher, base, base)).isGreaterThanOrEqualTo(scorer.score(base, base, base, base));
                assertThat(scorer.score(base, base, higher, base)).isGreaterThanOrEqualTo(scorer.score(base, base, base, base));
                assertThat(scorer.score(base, base, base, higher)).isGreaterThanOrEqualTo(scorer.score(base, base, base, base));
            }
        }
    }

    @Test
    void levelsFollowScoreBands() {
        assertThat(scorer.levelFor(80d)).isEqualTo(PriorityLevel.HIGH);
        assertThat(scorer.levelFor(75d)).isEqualTo(PriorityLevel.HIGH);
        assertThat(scorer.levelFor(60d)).isEqualTo(PriorityLevel.MEDIUM);
        assertThat(scorer.levelFor(54.9d)).isEqualTo(PriorityLevel.LOW);
    }
}
