package com.pulsebrief.insights.ai;

import com.pulsebrief.insights.model.Recommendation;

/**
 * Optional prose enrichment for a ranked recommendation. Implementations must not throw
 * for ordinary failures; they report them through {@link EnrichmentOutcome#failure}.
 */
public interface EnrichmentProvider {

    String name();

    EnrichmentOutcome enrich(Recommendation candidate, EnrichmentContext context);
}
