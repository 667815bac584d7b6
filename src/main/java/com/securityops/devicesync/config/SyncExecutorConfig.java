package com.securityops.devicesync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools used by a cross-sync run.
 */
@Slf4j
@Configuration
public class SyncExecutorConfig {

    /**
     * Bounded pool for store batches. Its size caps the number of batches in flight.
     */
    @Bean
    @Qualifier("syncWriteExecutor")
    public ThreadPoolTaskExecutor syncWriteExecutor(SyncProperties properties) {
        int parallelism = Math.max(1, properties.getCrossSync().getWriteParallelism());
        log.info("Initializing syncWriteExecutor with {} threads", parallelism);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setThreadNamePrefix("sync-write-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    /**
     * One thread per source catalog so both fetches run side by side.
     */
    @Bean
    @Qualifier("sourceFetchExecutor")
    public ThreadPoolTaskExecutor sourceFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setThreadNamePrefix("source-fetch-");
        executor.initialize();
        return executor;
    }
}
