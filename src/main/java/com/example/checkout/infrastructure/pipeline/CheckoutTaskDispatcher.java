package com.example.checkout.infrastructure.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Claims due tasks and hands them to an executor.
 */
@Component
public class CheckoutTaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CheckoutTaskDispatcher.class);

    private final CheckoutTaskQueue queue;
    private final CheckoutPipelineOrchestrator orchestrator;
    private final int batchSize;

    public CheckoutTaskDispatcher(
            CheckoutTaskQueue queue,
            CheckoutPipelineOrchestrator orchestrator,
            @Value("${checkout.poller.batch-size:50}") int batchSize) {
        this.queue = queue;
        this.orchestrator = orchestrator;
        this.batchSize = batchSize;
    }

    /**
     * @return number of tasks handed to {@code executor}
     */
    public int dispatchDue(Instant now, Executor executor) {
        List<String> due = queue.findDue(now, batchSize);
        int dispatched = 0;
        for (String taskId : due) {
            if (!queue.claim(taskId)) {
                continue;
            }
            try {
                executor.execute(() -> orchestrator.process(taskId));
                dispatched++;
            } catch (RejectedExecutionException e) {
                log.debug("Worker pool saturated, returning task {} to the queue", taskId);
                queue.unclaim(taskId);
                break;
            }
        }
        if (dispatched > 0) {
            log.debug("Dispatched {} checkout task(s)", dispatched);
        }
        return dispatched;
    }
}
