package com.pulsebrief.insights.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsebrief.insights.ai.EnrichmentProvider;
import com.pulsebrief.insights.ai.LlmClient;
import com.pulsebrief.insights.ai.LlmEnrichmentProvider;
import com.pulsebrief.insights.ai.TemplateEnrichmentProvider;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class InsightsConfig {

    private static final Logger log = LoggerFactory.getLogger(InsightsConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EnrichmentProvider enrichmentProvider(LlmClient client, ObjectMapper objectMapper) {
        if (client.hasCredentials()) {
            return new LlmEnrichmentProvider(client, objectMapper);
        }
        log.info("Enrichment: no AI api key configured, using template enrichment");
        return new TemplateEnrichmentProvider();
    }

    @Bean(name = "enrichmentExecutor", destroyMethod = "shutdownNow")
    public ExecutorService enrichmentExecutor(InsightsProperties properties) {
        int threads = Math.max(1, properties.recommendation().enrichmentBudget());
        return Executors.newFixedThreadPool(threads, daemonThreads("insights-enrich-"));
    }

    @Bean(name = "tenantRunExecutor", destroyMethod = "shutdown")
    public ExecutorService tenantRunExecutor(InsightsProperties properties) {
        return Executors.newFixedThreadPool(properties.schedule().tenantParallelism(), daemonThreads("insights-tenant-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
