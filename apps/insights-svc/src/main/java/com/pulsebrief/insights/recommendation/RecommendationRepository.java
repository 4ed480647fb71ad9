package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RecommendationStatus;
import java.util.List;
import java.util.Optional;

public interface RecommendationRepository {

    Recommendation save(Recommendation recommendation);

    Optional<Recommendation> findById(String id);

    List<Recommendation> findByTenant(String tenantId);

    List<Recommendation> findByStatus(RecommendationStatus status);
}
