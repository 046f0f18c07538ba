package com.example.regreport.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Configuration for asynchronous report runs and retry of outcome publishing
 */
@Slf4j
@Configuration
@EnableAsync
@EnableRetry
public class AsyncConfig {

    /**
     * Runs are heavy and rare; a small pool keeps concurrent runs bounded
     */
    @Bean(name = "taskExecutor")
    public Executor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("report-run-");
        executor.initialize();

        log.debug("Report run executor initialized with {} threads", executor.getMaxPoolSize());
        return executor;
    }
}
