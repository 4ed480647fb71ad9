package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.Recommendation;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Sorts by {@link PriorityScorer#RANKING}, caps each category, then truncates to the top
 * N. Pinned recommendations are always kept and still count toward their category.
 */
@Component
public class RecommendationRanker {

    private final int maxPerCategory;
    private final int topN;

    @Autowired

    public RecommendationRanker(InsightsProperties properties) {
        this(properties.recommendation().maxPerCategory(), properties.recommendation().topN());
    }

    RecommendationRanker(int maxPerCategory, int topN) {
        this.maxPerCategory = maxPerCategory;
        this.topN = topN;
    }

    public List<Recommendation> rank(List<Recommendation> candidates) {
        List<Recommendation> sorted = new ArrayList<>(candidates);
        sorted.sort(PriorityScorer.RANKING);
        long pinned = sorted.stream().filter(Recommendation::pinned).count();
        int openSlots = (int) Math.max(0, topN - pinned);

        Map<String, Integer> perCategory = new HashMap<>();
        sorted.stream().filter(Recommendation::pinned)
                .forEach(recommendation -> perCategory.merge(recommendation.category(), 1, Integer::sum));

        List<Recommendation> selected = new ArrayList<>();
        for (Recommendation recommendation : sorted) {
            if (recommendation.pinned()) {
                selected.add(recommendation);
                continue;
            }
            int used = perCategory.getOrDefault(recommendation.category(), 0);
            if (openSlots == 0 || used >= maxPerCategory) {
                continue;
            }
            perCategory.put(recommendation.category(), used + 1);
            selected.add(recommendation);
            openSlots--;
        }
        return selected;
    }
}
