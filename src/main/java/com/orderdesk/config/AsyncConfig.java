package com.orderdesk.config;

import java.lang.reflect.Method;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for order entry.
 *
 * <p>{@code orderEntryExecutor} runs blocking I/O hops (Redis reads, REST calls) and bus
 * dispatch. {@code orderEntryScheduler} drives the periodic position, buying power and
 * risk limit refreshes of every session.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${orderdesk.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${orderdesk.async.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${orderdesk.async.queue-capacity:500}")
    private int queueCapacity;

    @Value("${orderdesk.async.scheduler-pool-size:4}")
    private int schedulerPoolSize;

    @Bean("orderEntryExecutor")
    public ThreadPoolTaskExecutor orderEntryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("order-entry-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("orderEntryScheduler")
    public ThreadPoolTaskScheduler orderEntryScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerPoolSize);
        scheduler.setThreadNamePrefix("order-refresh-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /** Server timestamps drive staleness; this clock only supplies "now" for age checks. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Override
    public Executor getAsyncExecutor() {
        return orderEntryExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
