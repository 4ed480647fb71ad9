package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RecommendationStatus;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryRecommendationRepository implements RecommendationRepository {

    private final Map<String, Recommendation> storage = new ConcurrentHashMap<>();

    @Override
    public Recommendation save(Recommendation recommendation) {
        storage.put(recommendation.id(), recommendation);
        return recommendation;
    }

    @Override
    public Optional<Recommendation> findById(String id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<Recommendation> findByTenant(String tenantId) {
        return storage.values().stream()
                .filter(recommendation -> recommendation.tenantId().equals(tenantId))
                .sorted(PriorityScorer.RANKING)
                .toList();
    }

    @Override
    public List<Recommendation> findByStatus(RecommendationStatus status) {
        return storage.values().stream()
                .filter(recommendation -> recommendation.status() == status)
                .toList();
    }
}
