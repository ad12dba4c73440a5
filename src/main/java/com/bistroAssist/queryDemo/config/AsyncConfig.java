package com.bistroAssist.queryDemo.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Executors used by the query pipeline.
 * 
 * - pipelineExecutor: one task per query (single-shot and streaming producers)
 * - contextRetrievalExecutor: the fan-out lookups inside context retrieval
 * - analyticsExecutor: fire-and-forget query logging
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "pipelineExecutor")
    public Executor pipelineExecutor(
            @Value("${assistant.executors.pipeline-threads:16}") int threads,
            @Value("${assistant.executors.pipeline-queue-capacity:500}") int queueCapacity) {
        return buildExecutor("query-pipeline-", threads, queueCapacity);
    }

    @Bean(name = "contextRetrievalExecutor")
    public Executor contextRetrievalExecutor(
            @Value("${assistant.executors.retrieval-threads:16}") int threads,
            @Value("${assistant.executors.retrieval-queue-capacity:1000}") int queueCapacity) {
        return buildExecutor("context-lookup-", threads, queueCapacity);
    }

    @Bean(name = "analyticsExecutor")
    public Executor analyticsExecutor(
            @Value("${assistant.executors.analytics-threads:2}") int threads,
            @Value("${assistant.executors.analytics-queue-capacity:1000}") int queueCapacity) {
        return buildExecutor("analytics-", threads, queueCapacity);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private Executor buildExecutor(String prefix, int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int poolSize = Math.max(1, threads);
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Math.max(50, queueCapacity));
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }
}
