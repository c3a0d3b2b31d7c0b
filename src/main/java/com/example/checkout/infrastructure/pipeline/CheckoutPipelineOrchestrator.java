package com.example.checkout.infrastructure.pipeline;

import com.example.checkout.application.pipeline.CheckoutPayload;
import com.example.checkout.application.pipeline.CheckoutStage;
import com.example.checkout.application.pipeline.CheckoutStep;
import com.example.checkout.application.port.out.CheckoutAttemptPort;
import com.example.checkout.application.port.out.OrderNotificationPort;
import com.example.checkout.infrastructure.config.GracefulShutdownConfig;
import com.example.checkout.infrastructure.pipeline.CheckoutTaskQueue.ClaimedTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one claimed pipeline task.
 * <p>
 * On success the stage's writes, the task completion, the attempt status and the next step's
 * task commit together. On failure the whole transaction rolls back and the task is either
 * rescheduled with backoff or failed for good, which also fails the checkout attempt.
 */
@Component
public class CheckoutPipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CheckoutPipelineOrchestrator.class);

    private final Map<CheckoutStep, CheckoutStage<?, ?>> stages = new EnumMap<>(CheckoutStep.class);
    private final CheckoutTaskQueue queue;
    private final CheckoutAttemptPort attempts;
    private final OrderNotificationPort notifications;
    private final StageRetryPolicy retryPolicy;
    private final GracefulShutdownConfig shutdown;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public CheckoutPipelineOrchestrator(
            List<CheckoutStage<?, ?>> stageBeans,
            CheckoutTaskQueue queue,
            CheckoutAttemptPort attempts,
            OrderNotificationPort notifications,
            StageRetryPolicy retryPolicy,
            GracefulShutdownConfig shutdown,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        for (CheckoutStage<?, ?> stage : stageBeans) {
            CheckoutStage<?, ?> previous = stages.put(stage.step(), stage);
            if (previous != null) {
                throw new IllegalStateException("Two stages registered for " + stage.step());
            }
        }
        for (CheckoutStep step : CheckoutStep.values()) {
            if (!stages.containsKey(step)) {
                throw new IllegalStateException("No stage registered for " + step);
            }
        }
        this.queue = queue;
        this.attempts = attempts;
        this.notifications = notifications;
        this.retryPolicy = retryPolicy;
        this.shutdown = shutdown;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Executes the task if it is still claimed. Never throws; failures are recorded on the task.
     */
    public void process(String taskId) {
        shutdown.stageStarted();
        try {
            Optional<ClaimedTask> claimed = queue.findClaimed(taskId);
            if (claimed.isEmpty()) {
                log.debug("Task {} is no longer claimed, skipping", taskId);
                return;
            }
            run(claimed.get());
        } finally {
            shutdown.stageFinished();
        }
    }

    private void run(ClaimedTask task) {
        CheckoutStage<?, ?> stage = stages.get(task.step());
        CheckoutPayload input;
        try {
            input = queue.readPayload(task, stage.inputType());
        } catch (RuntimeException e) {
            log.error("Dropping task {} for checkout {}: {}", task.id(), task.checkoutId(), e.getMessage());
            queue.fail(task.id(), e.getMessage());
            attempts.markFailed(task.checkoutId(), "Unreadable pipeline state");
            return;
        }

        log.debug("Running {} for checkout {} (attempt {})", task.step(), task.checkoutId(), task.attempts());
        CheckoutPayload output;
        try {
            output = transactionTemplate.execute(status -> {
                CheckoutPayload result = execute(stage, input);
                queue.complete(task.id());
                attempts.advance(task.checkoutId(), task.step().completedStatus(), result.orderId());
                task.step().next().ifPresent(next -> queue.enqueue(next, result));
                return result;
            });
        } catch (RuntimeException e) {
            handleFailure(task, input, e);
            return;
        }

        log.info("Checkout {} completed {}", task.checkoutId(), task.step());
        notifications.checkoutProgress(input.userId(), task.checkoutId(),
                task.step().completedStatus().wireValue(), output.orderId(), null);
    }

    private void handleFailure(ClaimedTask task, CheckoutPayload input, RuntimeException failure) {
        Optional<Duration> delay = retryPolicy.nextDelay(failure, task.attempts());
        if (delay.isPresent()) {
            queue.reschedule(task.id(), failure.getMessage(), clock.instant().plus(delay.get()));
            return;
        }

        String reason = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        log.error("Checkout {} failed at {} after {} attempt(s): {}",
                task.checkoutId(), task.step(), task.attempts(), reason);
        queue.fail(task.id(), reason);
        attempts.markFailed(task.checkoutId(), reason);
        notifications.checkoutProgress(input.userId(), task.checkoutId(), "failed", input.orderId(), reason);
    }

    private static <I extends CheckoutPayload, O extends CheckoutPayload> O execute(
            CheckoutStage<I, O> stage, CheckoutPayload input) {
        return stage.execute(stage.inputType().cast(input));
    }
}
