package com.servicetracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: one long-lived thread per subscription worker and one per event-source poll loop.
 * Both are unbounded with a direct hand-off (no queue) since every task runs until its subscription ends.
 */
@Configuration
public class AsyncConfig {

    public static final String SUBSCRIPTION_WORKER_EXECUTOR = "subscription-worker-executor";
    public static final String EVENT_SOURCE_EXECUTOR = "event-source-executor";

    @Bean(name = SUBSCRIPTION_WORKER_EXECUTOR)
    public Executor subscriptionWorkerExecutor() {
        return unbounded("subscription-worker-");
    }

    @Bean(name = EVENT_SOURCE_EXECUTOR)
    public Executor eventSourceExecutor() {
        return unbounded("event-source-");
    }

    private static ThreadPoolTaskExecutor unbounded(String threadNamePrefix) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(0);
        e.setMaxPoolSize(Integer.MAX_VALUE);
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(60);
        e.setThreadNamePrefix(threadNamePrefix);
        e.initialize();
        return e;
    }
}
