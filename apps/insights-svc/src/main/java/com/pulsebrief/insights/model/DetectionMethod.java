package com.pulsebrief.insights.model;

/**
 * Detector tiers that can contribute to an anomaly.
 */
public enum DetectionMethod {
    /** Median/MAD robust z-score. */
    STATISTICAL,
    /** Seasonal trend forecast with a prediction interval. */
    SEASONAL,
    /** Isolation forest over engineered features. */
    MULTIVARIATE
}
