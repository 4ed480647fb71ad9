package com.pulsebrief.insights.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Comparator;
import java.util.List;

public record KpiSeries(String kpiName, List<KpiPoint> points, SamplingFrequency frequency) {

    public KpiSeries {
        if (kpiName == null || kpiName.isBlank()) {
            throw new IllegalArgumentException("kpiName must be provided");
        }
        points = points == null ? List.of() : points.stream()
                .sorted(Comparator.comparing(KpiPoint::timestamp))
                .toList();
        frequency = frequency == null ? SamplingFrequency.DAILY : frequency;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }
}
