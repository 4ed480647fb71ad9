package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.config.InsightsProperties;
import java.util.List;

final class AnomalyFixtures {

    private AnomalyFixtures() {
    }

    static AnomalyDetector detector(InsightsProperties properties, SeasonalModelCache cache) {
        return new AnomalyDetector(List.of(
                new StatisticalDetector(properties),
                new SeasonalDetector(cache, properties),
                new MultivariateDetector(properties)));
    }

    static SeasonalModelCache cache(InsightsProperties properties) {
        return new SeasonalModelCache(new SeasonalModelFitter(), properties);
    }
}
