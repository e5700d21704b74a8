package com.eyelevel.ocrprocessor.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Configures the managed thread pool that runs job dispatches in the background, so that
 * job creation never waits on extraction latency. Pool sizes come from
 * {@code app.processing.executor.*}.
 */
@Configuration
@RequiredArgsConstructor
public class TaskExecutorConfig {

    private final OcrProcessingConfig config;

    /**
     * Creates the pool used for fire-and-forget job dispatch.
     *
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("jobDispatchExecutor")
    public AsyncTaskExecutor jobDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getExecutor().getCoreSize());
        executor.setMaxPoolSize(config.getExecutor().getMaxSize());
        executor.setQueueCapacity(config.getExecutor().getQueueCapacity());
        executor.setThreadNamePrefix("job-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * The clock used for job timestamps and retention cut-offs.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
