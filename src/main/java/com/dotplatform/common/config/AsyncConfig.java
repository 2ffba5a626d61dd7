package com.dotplatform.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for work that must stay off the transactional request path:
 * real-time fan-out after commit and best-effort SMS notification.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    public static final String REALTIME_EXECUTOR = "realtimeExecutor";
    public static final String NOTIFICATION_EXECUTOR = "notificationExecutor";

    @Bean(name = REALTIME_EXECUTOR)
    public Executor realtimeExecutor(@Value("${dot.realtime.executor.pool-size:4}") int poolSize,
                                     @Value("${dot.realtime.executor.queue-capacity:10000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("realtime-");
        // Broadcast is best-effort: under overload the oldest pending event is dropped
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        executor.initialize();
        return executor;
    }

    @Bean(name = NOTIFICATION_EXECUTOR)
    public Executor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("notify-");
        executor.initialize();
        return executor;
    }
}
