package com.pulsebrief.insights;

import com.pulsebrief.insights.config.InsightsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(InsightsProperties.class)
@EnableScheduling
public class InsightsEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsightsEngineApplication.class, args);
    }
}
