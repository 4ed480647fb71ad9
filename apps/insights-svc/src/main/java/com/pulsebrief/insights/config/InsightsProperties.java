package com.pulsebrief.insights.config;

import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.ContentType;
import com.pulsebrief.insights.model.SensitivityProfile;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "insights")
public record InsightsProperties(
        Detection detection,
        Trend trend,
        Correlation correlation,
        Recommendation recommendation,
        Briefing briefing,
        Ai ai,
        Schedule schedule
) {

    @ConstructorBinding
    public InsightsProperties {
        detection = detection != null ? detection : Detection.defaults();
        trend = trend != null ? trend : Trend.defaults();
        correlation = correlation != null ? correlation : Correlation.defaults();
        recommendation = recommendation != null ? recommendation : Recommendation.defaults();
        briefing = briefing != null ? briefing : Briefing.defaults();
        ai = ai != null ? ai : Ai.defaults();
        schedule = schedule != null ? schedule : Schedule.defaults();
    }

    public static InsightsProperties defaults() {
        return new InsightsProperties(null, null, null, null, null, null, null);
    }

    public record Detection(
            Double statisticalWeight,
            Double seasonalWeight,
            Double multivariateWeight,
            SensitivityProfile defaultProfile,
            Map<String, Double> kpiThresholds,
            Integer robustWindow,
            Integer minHistory,
            Integer evaluationWindow,
            Integer maxGapFill,
            Integer staleAfterSteps,
            Duration modelMaxAge,
            Double refitErrorThreshold,
            Double thresholdStep,
            Double maxThresholdOffset,
            Double populationPriorCv,
            Integer forestTrees,
            Integer forestSampleSize,
            Double backtestMinRecall,
            Double backtestMaxFalsePositiveRate
    ) {
        public Detection {
            statisticalWeight = orDefault(statisticalWeight, 0.15d);
            seasonalWeight = orDefault(seasonalWeight, 0.55d);
            multivariateWeight = orDefault(multivariateWeight, 0.30d);
            if (statisticalWeight < 0 || seasonalWeight < 0 || multivariateWeight < 0
                    || statisticalWeight + seasonalWeight + multivariateWeight <= 0) {
                throw new IllegalArgumentException("detector weights must be non-negative with a positive sum");
            }
            defaultProfile = defaultProfile != null ? defaultProfile : SensitivityProfile.BALANCED;
            kpiThresholds = kpiThresholds != null ? Map.copyOf(kpiThresholds) : Map.of();
            kpiThresholds.forEach((kpi, value) -> {
                if (value <= 0d || value >= 1d) {
                    throw new IllegalArgumentException("threshold for " + kpi + " must be within (0,1)");
                }
            });
            robustWindow = positive(robustWindow, 28, "robustWindow");
            minHistory = positive(minHistory, 7, "minHistory");
            evaluationWindow = positive(evaluationWindow, 7, "evaluationWindow");
            maxGapFill = orDefault(maxGapFill, 3);
            staleAfterSteps = positive(staleAfterSteps, 3, "staleAfterSteps");
            modelMaxAge = modelMaxAge != null ? modelMaxAge : Duration.ofDays(7);
            refitErrorThreshold = orDefault(refitErrorThreshold, 0.25d);
            thresholdStep = orDefault(thresholdStep, 0.02d);
            maxThresholdOffset = orDefault(maxThresholdOffset, 0.15d);
            if (thresholdStep <= 0d || thresholdStep > maxThresholdOffset) {
                throw new IllegalArgumentException("thresholdStep must be positive and not exceed maxThresholdOffset");
            }
            populationPriorCv = orDefault(populationPriorCv, 0.1d);
            forestTrees = positive(forestTrees, 100, "forestTrees");
            forestSampleSize = positive(forestSampleSize, 64, "forestSampleSize");
            backtestMinRecall = orDefault(backtestMinRecall, 0.8d);
            backtestMaxFalsePositiveRate = orDefault(backtestMaxFalsePositiveRate, 0.1d);
        }

        static Detection defaults() {
            return new Detection(null, null, null, null, null, null, null, null, null, null, null, null, null,
                    null, null, null, null, null, null);
        }

        /** Static threshold for the KPI when configured, otherwise the profile threshold. */
        public double baseThresholdFor(String kpiName, double profileThreshold) {
            return kpiThresholds.getOrDefault(kpiName, profileThreshold);
        }
    }

    public record Trend(Double minChange, Double significance, Double volatilityCv, Double accelerationEpsilon) {
        public Trend {
            minChange = orDefault(minChange, 0.02d);
            significance = orDefault(significance, 0.05d);
            volatilityCv = orDefault(volatilityCv, 0.25d);
            accelerationEpsilon = orDefault(accelerationEpsilon, 0.001d);
            if (significance <= 0d || significance >= 1d) {
                throw new IllegalArgumentException("trend significance must be within (0,1)");
            }
        }

        static Trend defaults() {
            return new Trend(null, null, null, null);
        }
    }

    public record Correlation(
            Integer minLag,
            Integer maxLag,
            Double minCorrelation,
            Double significance,
            Integer minOverlap,
            Integer grangerOrder,
            Integer rootCauseDepth,
            Double jointAnomalyThreshold,
            Double defaultMatchFraction
    ) {
        public Correlation {
            minLag = orDefault(minLag, 1);
            maxLag = orDefault(maxLag, 14);
            if (minLag < 0 || maxLag < minLag) {
                throw new IllegalArgumentException("lag window must satisfy 0 <= minLag <= maxLag");
            }
            minCorrelation = orDefault(minCorrelation, 0.5d);
            significance = orDefault(significance, 0.05d);
            minOverlap = positive(minOverlap, 20, "minOverlap");
            grangerOrder = positive(grangerOrder, 2, "grangerOrder");
            rootCauseDepth = positive(rootCauseDepth, 2, "rootCauseDepth");
            jointAnomalyThreshold = orDefault(jointAnomalyThreshold, 0.6d);
            defaultMatchFraction = orDefault(defaultMatchFraction, 0.75d);
        }

        static Correlation defaults() {
            return new Correlation(null, null, null, null, null, null, null, null, null);
        }
    }

    public record Recommendation(
            Double urgencyWeight,
            Double impactWeight,
            Double feasibilityWeight,
            Double confidenceWeight,
            Integer maxPerCategory,
            Integer topN,
            Integer enrichmentBudget,
            Duration enrichmentTimeout,
            Duration ttl,
            Double ruleConfidence,
            Double patternConfidence,
            Double calibrationMin,
            Double calibrationMax,
            Double calibrationStep,
            String ruleTableLocation
    ) {
        public Recommendation {
            urgencyWeight = orDefault(urgencyWeight, 0.35d);
            impactWeight = orDefault(impactWeight, 0.30d);
            feasibilityWeight = orDefault(feasibilityWeight, 0.15d);
            confidenceWeight = orDefault(confidenceWeight, 0.20d);
            requireUnitSum("recommendation", urgencyWeight, impactWeight, feasibilityWeight, confidenceWeight);
            maxPerCategory = positive(maxPerCategory, 2, "maxPerCategory");
            topN = positive(topN, 5, "topN");
            enrichmentBudget = orDefault(enrichmentBudget, 3);
            enrichmentTimeout = enrichmentTimeout != null ? enrichmentTimeout : Duration.ofSeconds(5);
            ttl = ttl != null ? ttl : Duration.ofDays(14);
            ruleConfidence = orDefault(ruleConfidence, 0.95d);
            patternConfidence = orDefault(patternConfidence, 0.6d);
            calibrationMin = orDefault(calibrationMin, 0.5d);
            calibrationMax = orDefault(calibrationMax, 1.2d);
            calibrationStep = orDefault(calibrationStep, 0.1d);
            if (calibrationMin <= 0d || calibrationMin > 1d || calibrationMax < 1d) {
                throw new IllegalArgumentException("calibration bounds must bracket 1.0");
            }
            if (calibrationStep <= 0d || calibrationStep > 1d) {
                throw new IllegalArgumentException("calibrationStep must be within (0,1]");
            }
            ruleTableLocation = ruleTableLocation != null && !ruleTableLocation.isBlank()
                    ? ruleTableLocation
                    : "classpath:insights/rule-table.json";
        }

        static Recommendation defaults() {
            return new Recommendation(null, null, null, null, null, null, null, null, null, null, null, null,
                    null, null, null);
        }
    }

    public record Briefing(
            Double urgencyWeight,
            Double impactWeight,
            Double relevanceWeight,
            Double freshnessWeight,
            Double actionabilityWeight,
            Integer maxItems,
            Map<ContentType, Integer> typeCaps,
            Integer minDistinctSections,
            Integer wordsPerMinute,
            Map<BriefingType, Double> targetReadMinutes,
            Double typeBoost,
            Integer minEngagementHistory,
            Double personalizationMin,
            Double personalizationMax,
            Double freshnessDecayHours
    ) {
        public Briefing {
            urgencyWeight = orDefault(urgencyWeight, 0.30d);
            impactWeight = orDefault(impactWeight, 0.25d);
            relevanceWeight = orDefault(relevanceWeight, 0.20d);
            freshnessWeight = orDefault(freshnessWeight, 0.15d);
            actionabilityWeight = orDefault(actionabilityWeight, 0.10d);
            requireUnitSum("briefing", urgencyWeight, impactWeight, relevanceWeight, freshnessWeight, actionabilityWeight);
            maxItems = positive(maxItems, 7, "maxItems");
            Map<ContentType, Integer> caps = new EnumMap<>(ContentType.class);
            caps.put(ContentType.TASK, 3);
            caps.put(ContentType.ANOMALY, 2);
            caps.put(ContentType.MEETING, 3);
            caps.put(ContentType.MESSAGE, 2);
            caps.put(ContentType.INSIGHT, 2);
            caps.put(ContentType.DECISION, 2);
            caps.put(ContentType.KPI_SNAPSHOT, 1);
            caps.put(ContentType.RECOMMENDATION, 2);
            if (typeCaps != null) {
                caps.putAll(typeCaps);
            }
            typeCaps = Map.copyOf(caps);
            minDistinctSections = orDefault(minDistinctSections, 3);
            wordsPerMinute = positive(wordsPerMinute, 200, "wordsPerMinute");
            Map<BriefingType, Double> targets = new EnumMap<>(BriefingType.class);
            targets.put(BriefingType.MORNING, 3d);
            targets.put(BriefingType.EVENING, 4d);
            targets.put(BriefingType.WEEKLY, 6d);
            if (targetReadMinutes != null) {
                targets.putAll(targetReadMinutes);
            }
            targetReadMinutes = Map.copyOf(targets);
            typeBoost = orDefault(typeBoost, 1.2d);
            minEngagementHistory = positive(minEngagementHistory, 5, "minEngagementHistory");
            personalizationMin = orDefault(personalizationMin, 0.8d);
            personalizationMax = orDefault(personalizationMax, 1.25d);
            if (personalizationMin > 1d || personalizationMax < 1d) {
                throw new IllegalArgumentException("personalization bounds must bracket 1.0");
            }
            freshnessDecayHours = orDefault(freshnessDecayHours, 48d);
        }

        static Briefing defaults() {
            return new Briefing(null, null, null, null, null, null, null, null, null, null, null, null, null,
                    null, null);
        }

        public int capFor(ContentType type) {
            return typeCaps.getOrDefault(type, maxItems);
        }

        public double targetReadMinutesFor(BriefingType type) {
            return targetReadMinutes.getOrDefault(type, 5d);
        }
    }

    public record Ai(String provider, String model, String endpoint, String apiKey, Duration timeout) {
        public Ai {
            model = model != null && !model.isBlank() ? model : "gpt-4o-mini";
            endpoint = endpoint != null && !endpoint.isBlank() ? endpoint : "https://api.openai.com/v1/responses";
            timeout = timeout != null ? timeout : Duration.ofSeconds(10);
            // apiKey may be blank; enrichment then uses the deterministic template provider
        }

        static Ai defaults() {
            return new Ai(null, null, null, null, null);
        }

        public String providerOrDefault() {
            return (provider != null && !provider.isBlank()) ? provider.toLowerCase(Locale.ROOT) : "openai";
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public record Schedule(Integer tenantParallelism, Duration tenantRunTimeout) {
        public Schedule {
            tenantParallelism = positive(tenantParallelism, 4, "tenantParallelism");
            tenantRunTimeout = tenantRunTimeout != null ? tenantRunTimeout : Duration.ofMinutes(5);
        }

        static Schedule defaults() {
            return new Schedule(null, null);
        }
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    private static int positive(Integer value, int fallback, String name) {
        int resolved = value != null ? value : fallback;
        if (resolved <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return resolved;
    }

    private static void requireUnitSum(String formula, double... weights) {
        double sum = 0d;
        for (double weight : weights) {
            if (weight < 0d) {
                throw new IllegalArgumentException(formula + " weights must be non-negative");
            }
            sum += weight;
        }
        if (Math.abs(sum - 1d) > 1e-6) {
            throw new IllegalArgumentException(formula + " weights must sum to 1.0 but were " + sum);
        }
    }
}
