package com.opsagent.tracker.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    @Value("${tracker.executor.core-pool-size:6}")
    private int corePoolSize;

    @Value("${tracker.executor.max-pool-size:12}")
    private int maxPoolSize;

    /**
     * Worker pool used for every fan-out (per-field writes, type batches, scan pages).
     */
    @Bean("trackerTaskExecutor")
    public TaskExecutor trackerTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        executor.setQueueCapacity(500);
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("TrackerWorker-");
        executor.initialize();
        return executor;
    }
}
