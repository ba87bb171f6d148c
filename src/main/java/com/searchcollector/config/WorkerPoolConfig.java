package com.searchcollector.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Fixed-size worker pool for candidate tasks.
 */
@Slf4j
@Configuration
public class WorkerPoolConfig {

    /**
     * Left uninitialized; the container starts the pool through
     * {@code afterPropertiesSet()} and shuts it down on close.
     */
    @Bean(name = "collectorExecutor")
    public ThreadPoolTaskExecutor collectorExecutor(CollectorProperties properties) {
        int size = properties.getPool().getSize();
        log.info("Collector worker pool configured with {} slots", size);
        return newExecutor(size);
    }

    /**
     * Started pool for use outside a Spring context. The caller owns it and
     * must call {@code shutdown()}.
     */
    public static ThreadPoolTaskExecutor buildExecutor(int size) {
        ThreadPoolTaskExecutor executor = newExecutor(size);
        executor.initialize();
        return executor;
    }

    /**
     * Core and max size are equal so the pool never grows past {@code size};
     * extra tasks wait in the queue.
     */
    static ThreadPoolTaskExecutor newExecutor(int size) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix("collector-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }
}
