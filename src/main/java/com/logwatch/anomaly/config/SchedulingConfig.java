package com.logwatch.anomaly.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Timers for the ingest tick, baseline recomputation, model retraining and alert flush.
 * Disabled with engine.scheduling.enabled=false so tests can drive each task by hand.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(name = "engine.scheduling.enabled", havingValue = "true", matchIfMissing = true)
    static class EnabledScheduling {
    }
}
