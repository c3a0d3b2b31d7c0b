package com.example.checkout.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handles graceful shutdown by waiting for in-flight stage executions to complete.
 * Once shutdown starts no new tasks are dispatched; unfinished ones stay in the queue.
 */
@Component
public class GracefulShutdownConfig implements ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownConfig.class);
    private static final int MAX_WAIT_SECONDS = 25;

    private final AtomicInteger activeStages = new AtomicInteger(0);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    /**
     * Called when a worker starts executing a stage.
     */
    public void stageStarted() {
        int count = activeStages.incrementAndGet();
        log.debug("Stage started. Active stages: {}", count);
    }

    /**
     * Called when a worker finishes executing a stage, successfully or not.
     */
    public void stageFinished() {
        int count = activeStages.decrementAndGet();
        log.debug("Stage finished. Active stages: {}", count);
    }

    public int getActiveStageCount() {
        return activeStages.get();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        shuttingDown.set(true);
        log.info("Shutdown signal received. Active stages: {}", activeStages.get());

        int waitSeconds = MAX_WAIT_SECONDS;
        while (activeStages.get() > 0 && waitSeconds > 0) {
            log.info("Waiting for {} active stage(s) to complete... ({} seconds remaining)",
                    activeStages.get(), waitSeconds);
            try {
                Thread.sleep(1000);
                waitSeconds--;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted while waiting for stages to complete");
                break;
            }
        }

        if (activeStages.get() > 0) {
            log.warn("Graceful shutdown timeout. {} stage(s) will be resumed from the queue after restart.",
                    activeStages.get());
        } else {
            log.info("Graceful shutdown complete. All stages finished.");
        }
    }
}
