package com.pulsebrief.insights.anomaly;

import com.pulsebrief.insights.model.DetectionMethod;

/**
 * One tier of the anomaly ensemble. Implementations are stateless apart from caches
 * keyed by (tenant, KPI).
 */
public interface Detector {

    DetectionMethod method();

    /** Relative weight in the combined score. */
    double weight();

    DetectorResult detect(DetectionContext context);
}
