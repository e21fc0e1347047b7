package ru.tigran.churnpredictor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Конфигурация thread pool для параллельного обогащения отзывов (bulkhead)
 * Sentiment и topic extraction выполняются одновременно и не блокируют потоки Tomcat дольше нужного
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * Executor для вызовов inference сервиса.
     * При переполнении очереди задача выполняется в вызывающем потоке, чтобы запрос не зависал.
     */
    @Bean(name = "enrichmentExecutor")
    public Executor enrichmentExecutor(
            @Value("${app.enrichment.pool-size:8}") int poolSize,
            @Value("${app.enrichment.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("enrichment-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler((task, pool) -> {
            log.warn("Enrichment task rejected: queue is full, running in caller thread");
            new ThreadPoolExecutor.CallerRunsPolicy().rejectedExecution(task, pool);
        });
        executor.initialize();
        return executor;
    }
}
