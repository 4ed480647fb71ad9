package com.pulsebrief.insights.model;

import java.util.List;
import java.util.Locale;

public record FounderProfile(
        String tenantId,
        String displayName,
        String companyStage,
        List<String> focusAreas,
        SensitivityProfile sensitivity,
        Double customThreshold,
        String timezone
) {

    public FounderProfile {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must be provided");
        }
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
        sensitivity = sensitivity == null ? SensitivityProfile.BALANCED : sensitivity;
        if (sensitivity == SensitivityProfile.CUSTOM
                && (customThreshold == null || customThreshold <= 0d || customThreshold >= 1d)) {
            throw new IllegalArgumentException("custom sensitivity needs a threshold within (0,1)");
        }
        timezone = timezone == null || timezone.isBlank() ? "UTC" : timezone;
    }

    public static FounderProfile defaultFor(String tenantId) {
        return new FounderProfile(tenantId, null, null, List.of(), SensitivityProfile.BALANCED, null, "UTC");
    }

    public double detectionThreshold() {
        return sensitivity == SensitivityProfile.CUSTOM ? customThreshold : sensitivity.baseThreshold();
    }

    public boolean focusesOn(String topic) {
        if (topic == null) {
            return false;
        }
        String lower = topic.toLowerCase(Locale.ROOT);
        return focusAreas.stream().anyMatch(area -> lower.contains(area.toLowerCase(Locale.ROOT)));
    }
}
