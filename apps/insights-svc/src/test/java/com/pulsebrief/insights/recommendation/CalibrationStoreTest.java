package com.pulsebrief.insights.recommendation;

import static org.assertj.core.api.Assertions.assertThat;

import com.pulsebrief.insights.model.FeedbackAction;
import org.junit.jupiter.api.Test;

class CalibrationStoreTest {

    private final CalibrationStore store = new CalibrationStore(0.5d, 1.2d, 0.1d);

    @Test
    void startsNeutral() {
        assertThat(store.factorFor("tenant-a", "runway_watch")).isEqualTo(1d);
    }

    @Test
    void factorStaysWithinBoundsUnderRepeatedFeedback() {
        for (int i = 0; i < 200; i++) {
            assertThat(store.record("tenant-a", "noisy_rule", FeedbackAction.DISMISSED)).isBetween(0.5d, 1.2d);
            assertThat(store.record("tenant-a", "useful_rule", FeedbackAction.ACCEPTED)).isBetween(0.5d, 1.2d);
        }

        assertThat(store.factorFor("tenant-a", "noisy_rule")).isLessThan(0.51d);
        assertThat(store.factorFor("tenant-a", "useful_rule")).isGreaterThan(1.19d);
    }

    @Test
    void ignoringMovesHalfAsFarAsDismissing() {
        double dismissed = store.record("tenant-a", "a", FeedbackAction.DISMISSED);
        double ignored = store.record("tenant-a", "b", FeedbackAction.IGNORED);

        assertThat(1d - ignored).isLessThan(1d - dismissed);
        assertThat(ignored).isLessThan(1d);
    }

    @Test
    void tenantsAreCalibratedIndependently() {
        store.record("tenant-a", "runway_watch", FeedbackAction.DISMISSED);

        assertThat(store.factorFor("tenant-b", "runway_watch")).isEqualTo(1d);
    }
}
