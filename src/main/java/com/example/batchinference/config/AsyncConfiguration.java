package com.example.batchinference.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for the request pipeline.
 */
@Configuration
public class AsyncConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfiguration.class);

    /**
     * Runs per-source resolve/infer/normalize units. The pool size caps how many
     * images are downloaded and decoded at the same time; queued units hold only
     * their source string.
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor(InferenceProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getFetchConcurrency());
        executor.setMaxPoolSize(properties.getFetchConcurrency());
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    /**
     * Runs the inference part of accepted asynchronous jobs, detached from the
     * HTTP request that submitted them.
     */
    @Bean(name = "jobExecutor")
    public ThreadPoolTaskExecutor jobExecutor(InferenceProperties properties) {
        return backgroundExecutor("job-", properties.getJobConcurrency());
    }

    /**
     * Posts finished batches to their callback endpoints. Kept apart from
     * {@link #jobExecutor} so slow receivers never delay the next job.
     */
    @Bean(name = "callbackExecutor")
    public ThreadPoolTaskExecutor callbackExecutor(InferenceProperties properties) {
        return backgroundExecutor("callback-", properties.getCallback().getConcurrency());
    }

    private ThreadPoolTaskExecutor backgroundExecutor(String threadNamePrefix, int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setTaskDecorator(task -> () -> {
            try {
                task.run();
            } catch (RuntimeException ex) {
                log.error("Background task on {} terminated unexpectedly", threadNamePrefix, ex);
                throw ex;
            }
        });
        executor.initialize();
        return executor;
    }
}
