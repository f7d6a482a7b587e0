package com.drautomation.api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for async jobs, replication, recovery steps and timers.
 */
@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    public static final String REPLICATION_WORKER = "replicationWorkerExecutor";
    public static final String REPLICATION_REGIONS = "replicationRegionExecutor";
    public static final String RECOVERY_STEPS = "recoveryStepExecutor";

    /**
     * Runs backups, restores, recovery tests and recovery runs.
     */
    @Override
    @Bean(name = "taskExecutor")
    public Executor getAsyncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(10);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("automation-job-");
        executor.setKeepAliveSeconds(60);
        executor.setAllowCoreThreadTimeOut(true);

        // Backpressure instead of dropping jobs
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("Async executor initialized: corePoolSize={}, maxPoolSize={}, queueCapacity={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), executor.getQueueCapacity());

        return executor;
    }

    /**
     * Single worker draining the replication queue, one job at a time.
     */
    @Bean(name = REPLICATION_WORKER)
    public ThreadPoolTaskExecutor replicationWorkerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("replication-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Per-region copies of the job currently being replicated.
     */
    @Bean(name = REPLICATION_REGIONS)
    public ThreadPoolTaskExecutor replicationRegionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(32);
        executor.setThreadNamePrefix("replication-region-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Runs individual recovery steps so their timeouts can be enforced.
     */
    @Bean(name = RECOVERY_STEPS)
    public ThreadPoolTaskExecutor recoveryStepExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("recovery-step-");
        executor.initialize();
        return executor;
    }

    /**
     * Backs {@code @Scheduled} methods and the per-schedule backup timers.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("automation-scheduler-");
        scheduler.setErrorHandler(t -> log.error("Scheduled task failed: {}", t.getMessage(), t));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new CustomAsyncExceptionHandler();
    }

    /**
     * Logs exceptions escaping async methods together with their arguments.
     */
    private static class CustomAsyncExceptionHandler implements AsyncUncaughtExceptionHandler {
        @Override
        public void handleUncaughtException(Throwable ex, Method method, Object... params) {
            log.error("Async method {} threw exception: {}",
                    method.getName(),
                    ex.getMessage(),
                    ex);

            if (params.length > 0) {
                StringBuilder paramInfo = new StringBuilder("Parameters: ");
                for (int i = 0; i < params.length; i++) {
                    paramInfo.append(String.format("[%d]=%s ", i,
                            params[i] != null ? params[i].toString() : "null"));
                }
                log.error(paramInfo.toString());
            }
        }
    }
}
