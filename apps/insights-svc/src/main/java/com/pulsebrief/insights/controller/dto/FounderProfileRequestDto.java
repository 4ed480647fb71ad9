package com.pulsebrief.insights.controller.dto;

import com.pulsebrief.insights.model.FounderProfile;
import com.pulsebrief.insights.model.SensitivityProfile;
import jakarta.validation.constraints.Size;
import java.util.List;

public record FounderProfileRequestDto(
        @Size(max = 120) String displayName,
        @Size(max = 40) String companyStage,
        @Size(max = 10) List<String> focusAreas,
        SensitivityProfile sensitivity,
        Double customThreshold,
        @Size(max = 64) String timezone
) {

    public FounderProfile toProfile(String tenantId) {
        return new FounderProfile(tenantId, displayName, companyStage, focusAreas, sensitivity, customThreshold, timezone);
    }
}
