package com.pulsebrief.insights.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single observation. {@code value} is null when the source reported the slot but
 * could not provide a number.
 */
public record KpiPoint(Instant timestamp, Double value) {

    public KpiPoint {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
