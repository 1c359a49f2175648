package com.storefront.backend.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool for audit writes. When the queue is full new events are rejected and logged,
 * never run on the request thread.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "auditExecutor")
    public ThreadPoolTaskExecutor auditExecutor(
            @Value("${app.audit.pool-size:2}") int poolSize,
            @Value("${app.audit.queue-capacity:1000}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("audit-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
