package com.pulsebrief.insights.recommendation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pulsebrief.insights.Fixtures;
import com.pulsebrief.insights.model.FeedbackAction;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RecommendationStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecommendationServiceTest {

    private static final Instant CREATED = Instant.parse("2024-06-01T06:00:00Z");

    private InMemoryRecommendationRepository repository;
    private CalibrationStore calibration;
    private RecommendationService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRecommendationRepository();
        calibration = new CalibrationStore(0.5d, 1.2d, 0.1d);
        service = new RecommendationService(repository, calibration, Duration.ofDays(14));
    }

    @Test
    void feedbackMovesPendingOnceAndCalibrates() {
        service.storeRun(List.of(Fixtures.recommendation("r1", "growth", 80d, false, CREATED)));

        Recommendation accepted = service.applyFeedback("r1", FeedbackAction.ACCEPTED);

        assertThat(accepted.status()).isEqualTo(RecommendationStatus.ACCEPTED);
        assertThat(calibration.factorFor("tenant-a", "source-r1")).isGreaterThan(1d);
        assertThatThrownBy(() -> service.applyFeedback("r1", FeedbackAction.DISMISSED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot move from ACCEPTED to DISMISSED");
    }

    @Test
    void ignoredFeedbackExpires() {
        service.storeRun(List.of(Fixtures.recommendation("r1", "growth", 80d, false, CREATED)));

        assertThat(service.applyFeedback("r1", FeedbackAction.IGNORED).status()).isEqualTo(RecommendationStatus.EXPIRED);
    }

    @Test
    void unknownRecommendationIsNotFound() {
        assertThatThrownBy(() -> service.applyFeedback("missing", FeedbackAction.ACCEPTED))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void rerunDoesNotResetADecision() {
        Recommendation first = Fixtures.recommendation("r1", "growth", 80d, false, CREATED);
        service.storeRun(List.of(first));
        service.applyFeedback("r1", FeedbackAction.DISMISSED);

        List<Recommendation> stored = service.storeRun(List.of(first));

        assertThat(stored).singleElement().extracting(Recommendation::status).isEqualTo(RecommendationStatus.DISMISSED);
    }

    @Test
    void listFiltersByStatus() {
        service.storeRun(List.of(
                Fixtures.recommendation("r1", "growth", 80d, false, CREATED),
                Fixtures.recommendation("r2", "runway", 90d, true, CREATED)));
        service.applyFeedback("r1", FeedbackAction.SCHEDULED);

        assertThat(service.listForTenant("tenant-a", null)).extracting(Recommendation::id).containsExactly("r2", "r1");
        assertThat(service.listForTenant("tenant-a", RecommendationStatus.PENDING)).extracting(Recommendation::id)
                .containsExactly("r2");
        assertThat(service.listForTenant("tenant-b", null)).isEmpty();
    }

    @Test
    void expiryJobExpiresOnlyRecommendationsPastTtl() {
        service.storeRun(List.of(
                Fixtures.recommendation("old", "growth", 80d, false, CREATED),
                Fixtures.recommendation("fresh", "growth", 70d, false, CREATED.plus(Duration.ofDays(10)))));
        Clock clock = Clock.fixed(CREATED.plus(Duration.ofDays(15)), ZoneOffset.UTC);

        int expired = new RecommendationExpiryJob(service, clock).expireNow();

        assertThat(expired).isEqualTo(1);
        assertThat(service.get("old").status()).isEqualTo(RecommendationStatus.EXPIRED);
        assertThat(service.get("fresh").status()).isEqualTo(RecommendationStatus.PENDING);
        assertThat(calibration.factorFor("tenant-a", "source-old")).isLessThan(1d);
    }
}
