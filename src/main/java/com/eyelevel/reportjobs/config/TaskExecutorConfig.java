package com.eyelevel.reportjobs.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the two bounded thread pools used by job orchestration.
 * <p>
 * Orchestrator runs block while waiting for their generation tasks, so the tasks get a pool of their own.
 * Core size equals max size in both pools, so every thread is in use before anything queues.
 */
@Slf4j
@Configuration
public class TaskExecutorConfig {

    /**
     * Runs orchestrator invocations handed off by the local dispatcher.
     */
    @Bean("reportDispatchExecutor")
    public ThreadPoolTaskExecutor reportDispatchExecutor(final ReportJobsProperties properties) {
        final ReportJobsProperties.Dispatch dispatch = properties.dispatch();
        log.info("Configuring dispatch executor: threads={}, queue={}", dispatch.poolSize(),
                 dispatch.queueCapacity());
        final ThreadPoolTaskExecutor executor = boundedPool(dispatch.poolSize(), dispatch.queueCapacity(),
                                                            "report-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Runs the per-artifact generation tasks of every job.
     */
    @Bean("reportGenerationExecutor")
    public ThreadPoolTaskExecutor reportGenerationExecutor(final ReportJobsProperties properties) {
        final ReportJobsProperties.Generation generation = properties.generation();
        log.info("Configuring generation executor: threads={}, queue={}", generation.poolSize(),
                 generation.queueCapacity());
        final ThreadPoolTaskExecutor executor = boundedPool(generation.poolSize(), generation.queueCapacity(),
                                                            "report-gen-");
        executor.initialize();
        return executor;
    }

    private static ThreadPoolTaskExecutor boundedPool(final int threads, final int queueCapacity,
                                                      final String threadNamePrefix) {
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix(threadNamePrefix);
        return executor;
    }
}
