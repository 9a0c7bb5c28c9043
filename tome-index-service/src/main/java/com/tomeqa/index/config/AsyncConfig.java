package com.tomeqa.index.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/** Executors of rebuild runs and of parallel embedding batches. */
@Configuration
public class AsyncConfig {

    /**
     * Runs rebuilds. Work beyond the queue is rejected, which the REST layer reports as 503.
     */
    @Bean(name = "rebuildExecutor")
    public ThreadPoolTaskExecutor rebuildExecutor(
            @Value("${tomeqa.index.rebuild.threads:2}") int threads,
            @Value("${tomeqa.index.rebuild.queue-capacity:4}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("rebuild-");
        executor.initialize();
        return executor;
    }

    /**
     * Embeds chunk batches. A full queue runs the batch on the submitting rebuild thread.
     */
    @Bean(name = "embedExecutor")
    public ThreadPoolTaskExecutor embedExecutor(
            @Value("${tomeqa.index.ingest.embed-parallelism:4}") int parallelism,
            @Value("${tomeqa.index.ingest.embed-queue-capacity:64}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("embed-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
