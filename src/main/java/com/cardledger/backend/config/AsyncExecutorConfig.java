package com.cardledger.backend.config;

import java.time.Clock;
import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    /**
     * Per-page extraction calls.
     */
    @Bean(name = "reconciliationTaskExecutor")
    public Executor reconciliationTaskExecutor(ExtractionProperties extractionProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(extractionProperties.corePoolSize());
        executor.setMaxPoolSize(extractionProperties.maxPoolSize());
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("reconciliation-");
        executor.initialize();
        return executor;
    }

    /**
     * Only runs the statement matcher and the overlap detector, so a hung extractor on the
     * reconciliation pool cannot hold them up.
     */
    @Bean(name = "duplicateCheckExecutor")
    public Executor duplicateCheckExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("duplicate-check-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
