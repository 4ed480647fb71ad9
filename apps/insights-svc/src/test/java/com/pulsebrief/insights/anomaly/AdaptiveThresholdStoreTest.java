package com.pulsebrief.insights.anomaly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.pulsebrief.insights.model.FeedbackAction;
import org.junit.jupiter.api.Test;

class AdaptiveThresholdStoreTest {

    private final AdaptiveThresholdStore store = new AdaptiveThresholdStore(0.02d, 0.15d);

    @Test
    void offsetStaysWithinBoundsUnderRepeatedFeedback() {
        for (int i = 0; i < 50; i++) {
            store.recordFeedback("t", "mrr", FeedbackAction.DISMISSED);
        }
        assertThat(store.offsetFor("t", "mrr")).isCloseTo(0.15d, within(1e-9));

        for (int i = 0; i < 50; i++) {
            store.recordFeedback("t", "mrr", FeedbackAction.ACCEPTED);
        }
        ThresholdState state = store.stateFor("t", "mrr");
        assertThat(state.offset()).isCloseTo(-0.15d, within(1e-9));
        assertThat(state.confirmations()).isEqualTo(50);
        assertThat(state.dismissals()).isEqualTo(50);
    }

    @Test
    void ignoredRaisesThresholdLikeDismissal() {
        store.recordFeedback("t", "burn", FeedbackAction.IGNORED);

        assertThat(store.offsetFor("t", "burn")).isCloseTo(0.02d, within(1e-9));
        assertThat(store.offsetFor("t", "other")).isZero();
    }
}
