package com.pulsebrief.insights.model;

import java.util.List;

public record PatternMatch(
        String patternName,
        String description,
        double fractionSatisfied,
        boolean matched,
        List<String> satisfiedConditions,
        List<String> unmetConditions
) {

    public PatternMatch {
        satisfiedConditions = satisfiedConditions == null ? List.of() : List.copyOf(satisfiedConditions);
        unmetConditions = unmetConditions == null ? List.of() : List.copyOf(unmetConditions);
    }
}
