package com.company.radar.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools for account pipelines, the analysis stage and async event listeners.
 */
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    public static final String EVENT_EXECUTOR = "eventExecutor";

    private final RadarProperties properties;

    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        RadarProperties.Pipeline pipeline = properties.getPipeline();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pipeline.getWorkerPoolSize());
        executor.setMaxPoolSize(pipeline.getWorkerPoolSize());
        executor.setQueueCapacity(pipeline.getQueueCapacity());
        executor.setThreadNamePrefix("pipeline-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        // Local runs are marked interrupted by LocalRunRegistry, no need to wait for them
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        int parallelism = properties.getPipeline().getAnalysisParallelism();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // One slot per analyzer for every concurrent pipeline
        executor.setCorePoolSize(parallelism * properties.getPipeline().getWorkerPoolSize());
        executor.setMaxPoolSize(parallelism * properties.getPipeline().getWorkerPoolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("analysis-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Small pool for {@code @Async} application event listeners such as cache eviction.
     */
    @Bean(name = EVENT_EXECUTOR)
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
