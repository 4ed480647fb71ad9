package com.pulsebrief.insights.recommendation;

import com.pulsebrief.insights.ai.EnrichmentContext;
import com.pulsebrief.insights.ai.EnrichmentOutcome;
import com.pulsebrief.insights.ai.EnrichmentProvider;
import com.pulsebrief.insights.config.InsightsProperties;
import com.pulsebrief.insights.model.Recommendation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Enriches the first K ranked recommendations in parallel on a bounded executor. Calls
 * share one deadline; a call that misses it is cancelled and its recommendation is kept
 * unenriched. Ranking fields and order are never changed here.
 */
@Component
public class RecommendationEnricher {

    private static final Logger log = LoggerFactory.getLogger(RecommendationEnricher.class);

    private final EnrichmentProvider provider;
    private final ExecutorService executor;
    private final int budget;
    private final Duration timeout;

    @Autowired

    public RecommendationEnricher(EnrichmentProvider provider,
                                  @Qualifier("enrichmentExecutor") ExecutorService executor,
                                  InsightsProperties properties) {
        this(provider, executor, properties.recommendation().enrichmentBudget(),
                properties.recommendation().enrichmentTimeout());
    }

    RecommendationEnricher(EnrichmentProvider provider, ExecutorService executor, int budget, Duration timeout) {
        this.provider = provider;
        this.executor = executor;
        this.budget = budget;
        this.timeout = timeout;
    }

    public EnrichmentResult enrich(List<Recommendation> ranked, EnrichmentContext context) {
        int count = Math.min(budget, ranked.size());
        List<Future<EnrichmentOutcome>> calls = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Recommendation candidate = ranked.get(i);
            calls.add(executor.submit(() -> provider.enrich(candidate, context)));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        List<Recommendation> result = new ArrayList<>(ranked);
        int failures = 0;
        for (int i = 0; i < count; i++) {
            Recommendation candidate = ranked.get(i);
            Future<EnrichmentOutcome> call = calls.get(i);
            try {
                EnrichmentOutcome outcome = call.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                if (outcome != null && outcome.successful()) {
                    result.set(i, candidate.withEnrichment(outcome.rationale(), outcome.actionItems()));
                } else {
                    failures++;
                    log.warn("Enrichment: provider={} declined recommendation {}: {}", provider.name(), candidate.id(),
                            outcome == null ? "no outcome" : outcome.failureReason());
                }
            } catch (TimeoutException ex) {
                call.cancel(true);
                failures++;
                log.warn("Enrichment: provider={} timed out after {} for recommendation {}", provider.name(), timeout,
                        candidate.id());
            } catch (ExecutionException ex) {
                failures++;
                log.warn("Enrichment: provider={} failed for recommendation {}", provider.name(), candidate.id(),
                        ex.getCause());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                cancelRemaining(calls, i);
                failures += count - i;
                log.warn("Enrichment: interrupted, keeping {} recommendations unenriched", count - i);
                break;
            }
        }
        return new EnrichmentResult(result, count, failures);
    }

    private void cancelRemaining(List<Future<EnrichmentOutcome>> calls, int from) {
        for (int i = from; i < calls.size(); i++) {
            calls.get(i).cancel(true);
        }
    }

    public record EnrichmentResult(List<Recommendation> recommendations, int attempted, int failed) {

        public EnrichmentResult {
            recommendations = List.copyOf(recommendations);
        }
    }
}
