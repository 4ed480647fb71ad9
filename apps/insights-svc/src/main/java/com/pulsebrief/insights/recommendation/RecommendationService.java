package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.FeedbackAction;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RecommendationStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Stores produced recommendations and applies founder feedback. Status changes go through
 * {@link Recommendation#withStatus}, so a decided recommendation cannot be decided again.
 */
@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final RecommendationRepository repository;
    private final CalibrationStore calibration;
    private final Duration ttl;

    @Autowired

    public RecommendationService(RecommendationRepository repository, CalibrationStore calibration,
                                 InsightsProperties properties) {
        this(repository, calibration, properties.recommendation().ttl());
    }

    RecommendationService(RecommendationRepository repository, CalibrationStore calibration, Duration ttl) {
        this.repository = repository;
        this.calibration = calibration;
        this.ttl = ttl;
    }

    /**
     * Saves this run's recommendations. A recommendation the founder already decided keeps
     * its decision when a rerun produces the same id.
     */
    public List<Recommendation> storeRun(List<Recommendation> recommendations) {
        List<Recommendation> stored = new ArrayList<>();
        for (Recommendation recommendation : recommendations) {
            Recommendation existing = repository.findById(recommendation.id()).orElse(null);
            if (existing != null && existing.status().isTerminal()) {
                stored.add(existing);
                continue;
            }
            stored.add(repository.save(recommendation));
        }
        return stored;
    }

    public List<Recommendation> listForTenant(String tenantId, RecommendationStatus status) {
        return repository.findByTenant(tenantId).stream()
                .filter(recommendation -> status == null || recommendation.status() == status)
                .toList();
    }

    public Recommendation get(String id) {
        return repository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Recommendation not found: " + id));
    }

    /**
     * @throws NoSuchElementException when the id is unknown
     * @throws IllegalStateException  when the recommendation is no longer pending
     */
    public Recommendation applyFeedback(String id, FeedbackAction action) {
        Recommendation current = get(id);
        Recommendation updated = repository.save(current.withStatus(statusFor(action)));
        double factor = calibration.record(updated.tenantId(), updated.sourceKey(), action);
        log.info("Recommendation feedback: id={} tenant={} action={} source={} calibration={}",
                id, updated.tenantId(), action, updated.sourceKey(), factor);
        return updated;
    }

    /** Expires pending recommendations older than the ttl; expiry counts as ignored. */
    public int expirePending(Instant now) {
        Instant cutoff = now.minus(ttl);
        int expired = 0;
        for (Recommendation recommendation : repository.findByStatus(RecommendationStatus.PENDING)) {
            if (!recommendation.createdAt().isAfter(cutoff)) {
                repository.save(recommendation.withStatus(RecommendationStatus.EXPIRED));
                calibration.record(recommendation.tenantId(), recommendation.sourceKey(), FeedbackAction.IGNORED);
                expired++;
            }
        }
        return expired;
    }

    static RecommendationStatus statusFor(FeedbackAction action) {
        return switch (action) {
            case ACCEPTED -> RecommendationStatus.ACCEPTED;
            case SCHEDULED -> RecommendationStatus.SCHEDULED;
            case DISMISSED -> RecommendationStatus.DISMISSED;
            case IGNORED -> RecommendationStatus.EXPIRED;
        };
    }
}
