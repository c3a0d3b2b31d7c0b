package com.example.checkout.infrastructure.pipeline;

import com.example.checkout.infrastructure.config.GracefulShutdownConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Polls the checkout task queue and runs due steps on the worker pool.
 */
@Component
@ConditionalOnProperty(value = "checkout.poller.enabled", havingValue = "true", matchIfMissing = true)
public class CheckoutTaskPoller {

    private static final Logger log = LoggerFactory.getLogger(CheckoutTaskPoller.class);

    private final CheckoutTaskDispatcher dispatcher;
    private final CheckoutTaskQueue queue;
    private final TaskExecutor workerExecutor;
    private final GracefulShutdownConfig shutdown;
    private final Clock clock;
    private final Duration staleAfter;

    public CheckoutTaskPoller(
            CheckoutTaskDispatcher dispatcher,
            CheckoutTaskQueue queue,
            @Qualifier("checkoutWorkerExecutor") TaskExecutor workerExecutor,
            GracefulShutdownConfig shutdown,
            Clock clock,
            @Value("${checkout.poller.stale-after:5m}") Duration staleAfter) {
        this.dispatcher = dispatcher;
        this.queue = queue;
        this.workerExecutor = workerExecutor;
        this.shutdown = shutdown;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    /**
     * Dispatches due tasks.
     * Runs at a fixed interval configured in application.yml.
     */
    @Scheduled(fixedDelayString = "${checkout.poller.interval-ms:1000}")
    public void pollAndDispatch() {
        if (shutdown.isShuttingDown()) {
            return;
        }
        dispatcher.dispatchDue(clock.instant(), workerExecutor);
    }

    /**
     * Returns tasks held by a worker that died back to the queue.
     * Runs every 30 seconds.
     */
    @Scheduled(fixedRate = 30000)
    public void releaseStaleTasks() {
        int released = queue.releaseStale(clock.instant().minus(staleAfter));
        if (released > 0) {
            log.warn("Released {} checkout task(s) held longer than {}", released, staleAfter);
        }
    }

    /**
     * Cleans up old processed tasks.
     * Runs every hour.
     */
    @Scheduled(fixedRate = 3600000)
    public void cleanupProcessedTasks() {
        Instant cutoff = clock.instant().minus(24, ChronoUnit.HOURS);
        int deleted = queue.purgeProcessedBefore(cutoff);
        if (deleted > 0) {
            log.info("Cleaned up {} processed checkout tasks older than 24 hours", deleted);
        }
    }
}
