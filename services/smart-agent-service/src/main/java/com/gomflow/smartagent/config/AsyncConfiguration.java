package com.gomflow.smartagent.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the verification pipeline.
 *
 * <ul>
 *   <li>verification workers: one long-running thread per dispatcher worker</li>
 *   <li>extraction: runs the vision call of each in-flight job next to its OCR call</li>
 *   <li>port calls: individual HTTP attempts, so a hung remote side can be abandoned at its deadline</li>
 *   <li>job retry scheduler: delayed re-enqueue of failed jobs</li>
 * </ul>
 */
@Slf4j
@Configuration
public class AsyncConfiguration {

    @Bean(name = "verificationWorkerExecutor")
    public ThreadPoolTaskExecutor verificationWorkerExecutor(SmartAgentProperties properties) {
        int workers = properties.getDispatcher().getWorkers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("verification-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getDispatcher().getShutdownGrace().toSeconds());
        executor.initialize();

        log.info("Initialized verification worker executor - Workers: {}, Reserved for HIGH: {}",
                workers, properties.getDispatcher().getReservedHighPriorityWorkers());
        return executor;
    }

    @Bean(name = "extractionExecutor")
    public ThreadPoolTaskExecutor extractionExecutor(SmartAgentProperties properties) {
        int workers = properties.getDispatcher().getWorkers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(workers * 2);
        executor.setThreadNamePrefix("extraction-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setRejectedExecutionHandler(new CallerRunsWithLogging());
        executor.initialize();
        return executor;
    }

    @Bean(name = "portCallExecutor")
    public ThreadPoolTaskExecutor portCallExecutor(SmartAgentProperties properties) {
        int threads = properties.getPorts().getExecutorThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads * 2);
        executor.setQueueCapacity(threads * 4);
        executor.setThreadNamePrefix("port-call-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        // running inline would hold the worker past the call deadline; rejection is retried instead
        executor.setRejectedExecutionHandler(new AbortWithLogging());
        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(120);
        executor.initialize();

        log.info("Initialized port call executor - Core: {}, Max: {}", threads, threads * 2);
        return executor;
    }

    @Bean(name = "jobRetryScheduler")
    public ThreadPoolTaskScheduler jobRetryScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("job-retry-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Carries the submitting thread's MDC (job and extraction ids) onto pool threads.
     */
    static class MdcTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        }
    }

    static class AbortWithLogging implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("Port call pool saturated, rejecting call - Pool: {}, Active: {}, Queue: {}",
                    executor.getPoolSize(), executor.getActiveCount(), executor.getQueue().size());
            throw new RejectedExecutionException("Port call pool saturated");
        }
    }

    private static class CallerRunsWithLogging implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (!executor.isShutdown()) {
                log.warn("Thread pool saturated, running task in caller thread - Pool: {}, Active: {}, Queue: {}",
                        executor.getPoolSize(), executor.getActiveCount(), executor.getQueue().size());
                r.run();
            } else {
                log.error("Executor shutdown, task rejected: {}", r);
                throw new RejectedExecutionException("Executor shut down");
            }
        }
    }
}
