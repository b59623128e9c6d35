package com.deepansh.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Dedicated thread pool for tool handlers.
 *
 * Queue capacity is zero, so every ready graph node gets a thread immediately and
 * parallelism is bounded by the ready set rather than by the pool. Handlers that
 * outlive their timeout keep their thread until they return.
 */
@Configuration
public class SchedulerConfig {

    @Bean(name = "toolTaskExecutor")
    public Executor toolTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(256);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("tool-exec-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
