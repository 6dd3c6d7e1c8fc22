package com.perpconnector.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for network-bound work. Poll fetches and order submissions run on separate
 * pools so a slow poll never delays order placement.
 */
@Configuration
public class AsyncConfig {

    private final ConnectorProperties connectorProperties;

    public AsyncConfig(ConnectorProperties connectorProperties) {
        this.connectorProperties = connectorProperties;
    }

    @Bean("pollExecutor")
    public ThreadPoolTaskExecutor pollExecutor() {
        ConnectorProperties.Async async = connectorProperties.getAsync();
        return executor("poll-", async.getPollPoolSize(), async.getQueueCapacity());
    }

    @Bean("submissionExecutor")
    public ThreadPoolTaskExecutor submissionExecutor() {
        ConnectorProperties.Async async = connectorProperties.getAsync();
        return executor("submit-", async.getSubmissionPoolSize(), async.getQueueCapacity());
    }

    private ThreadPoolTaskExecutor executor(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
