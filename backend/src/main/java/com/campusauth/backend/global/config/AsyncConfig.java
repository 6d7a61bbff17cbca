package com.campusauth.backend.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Bounded pool for Argon2 work. A full queue rejects instead of growing, which callers
     * surface as a retryable 503.
     */
    @Bean(name = "passwordHashingExecutor")
    public ThreadPoolTaskExecutor passwordHashingExecutor(
            @Value("${app.security.password-hashing.pool-size:0}") int configuredPoolSize,
            @Value("${app.security.password-hashing.queue-capacity:64}") int queueCapacity
    ) {
        int processors = Runtime.getRuntime().availableProcessors();
        int poolSize = configuredPoolSize > 0 ? configuredPoolSize : Math.max(2, processors);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("password-hash-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
