package com.scoutiq.ai.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Bounded pools for source dispatch, price lookups and whole-pipeline submissions.
 */
@Configuration
public class ExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService retrievalExecutor(RetrievalConfig retrievalConfig) {
        return Executors.newFixedThreadPool(Math.max(2, retrievalConfig.getPoolSize()));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService priceLookupExecutor(RetrievalConfig retrievalConfig) {
        return Executors.newFixedThreadPool(Math.max(1, retrievalConfig.getLookupMaxConcurrency()));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor(AgentConfig agentConfig) {
        return Executors.newFixedThreadPool(Math.max(1, agentConfig.getPipelinePoolSize()));
    }
}
