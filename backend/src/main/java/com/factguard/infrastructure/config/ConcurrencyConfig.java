package com.factguard.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded executors for the validation pipeline.
 * Stage fan-out and knowledge-source lookups use separate pools so that a stage
 * waiting on lookups can never starve the lookups themselves.
 */
@Slf4j
@Configuration
public class ConcurrencyConfig {

    @Value("${factguard.pipeline.stage-threads:8}")
    private int stageThreads;

    @Value("${factguard.verification.max-concurrency:16}")
    private int lookupThreads;

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor() {
        log.info("Pipeline stage executor: {} threads", stageThreads);
        return Executors.newFixedThreadPool(stageThreads, named("pipeline-stage"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService verificationExecutor() {
        log.info("Knowledge lookup executor: {} threads", lookupThreads);
        return Executors.newFixedThreadPool(lookupThreads, named("knowledge-lookup"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
