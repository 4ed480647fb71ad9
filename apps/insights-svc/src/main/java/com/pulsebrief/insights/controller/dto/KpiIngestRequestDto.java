package com.pulsebrief.insights.controller.dto;

import com.pulsebrief.insights.model.KpiPoint;
import com.pulsebrief.insights.model.SamplingFrequency;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;

public record KpiIngestRequestDto(
        @NotBlank @Size(max = 64) String kpiName,
        SamplingFrequency frequency,
        @NotEmpty @Size(max = 5000) List<@Valid PointDto> points
) {

    public SamplingFrequency frequencyOrDefault() {
        return frequency == null ? SamplingFrequency.DAILY : frequency;
    }

    public List<KpiPoint> toPoints() {
        return points.stream().map(point -> new KpiPoint(point.timestamp(), point.value())).toList();
    }

    /** A null value marks a missing observation. */
    public record PointDto(@NotNull Instant timestamp, Double value) {
    }
}
