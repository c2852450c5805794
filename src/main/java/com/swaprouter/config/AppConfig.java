package com.swaprouter.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Application-wide Spring configuration.
 */
@Configuration
@EnableConfigurationProperties(SwapRouterProperties.class)
public class AppConfig {

    public static final String ROUTE_WORKER_EXECUTOR = "route-worker-executor";
    public static final String ROUTE_REFRESH_EXECUTOR = "route-refresh-executor";

    /**
     * Scheduler for route computation timeouts.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("swaprouter-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * Bounded pool running route computations away from request threads.
     *
     * <p>Threads grow from core to max only once the queue is full; beyond that new requests
     * are rejected with {@link org.springframework.core.task.TaskRejectedException}.
     */
    @Bean(name = ROUTE_WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor routeWorkerExecutor(SwapRouterProperties properties) {
        SwapRouterProperties.Computation computation = properties.getComputation();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(computation.getCorePoolSize());
        executor.setMaxPoolSize(computation.getMaxPoolSize());
        executor.setQueueCapacity(computation.getQueueCapacity());
        executor.setThreadNamePrefix("route-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    /**
     * Prepares background route refreshes (token lookup, request encoding) off the reading thread.
     */
    @Bean(name = ROUTE_REFRESH_EXECUTOR)
    public ThreadPoolTaskExecutor routeRefreshExecutor(SwapRouterProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(properties.getComputation().getQueueCapacity());
        executor.setThreadNamePrefix("route-refresh-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
