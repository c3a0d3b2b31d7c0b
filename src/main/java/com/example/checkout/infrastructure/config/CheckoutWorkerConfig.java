package com.example.checkout.infrastructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded worker pool for pipeline stages. A full pool rejects, and the poller leaves
 * the remaining tasks in the queue for the next round.
 */
@Configuration
public class CheckoutWorkerConfig {

    @Value("${checkout.worker.pool-size:4}")
    private int poolSize;

    @Value("${checkout.worker.queue-capacity:100}")
    private int queueCapacity;

    @Bean(name = "checkoutWorkerExecutor")
    public ThreadPoolTaskExecutor checkoutWorkerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("checkout-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(25);
        executor.initialize();
        return executor;
    }
}
