package com.example.checkout.infrastructure.pipeline;

import com.example.checkout.application.pipeline.CheckoutPayload;
import com.example.checkout.application.pipeline.CheckoutStep;
import com.example.checkout.application.port.out.CheckoutQueuePort;
import com.example.checkout.infrastructure.persistence.entity.CheckoutTaskEntity;
import com.example.checkout.infrastructure.persistence.entity.CheckoutTaskStatus;
import com.example.checkout.infrastructure.persistence.repository.CheckoutTaskRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable queue of pipeline steps backed by the {@code checkout_tasks} table.
 * <p>
 * A task is claimed by a conditional update from PENDING to PROCESSING, so at most one
 * worker runs it at a time.
 */
@Component
public class CheckoutTaskQueue implements CheckoutQueuePort {

    private static final Logger log = LoggerFactory.getLogger(CheckoutTaskQueue.class);

    private final CheckoutTaskRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CheckoutTaskQueue(CheckoutTaskRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void enqueue(CheckoutStep step, CheckoutPayload input) {
        if (repository.existsByCheckoutIdAndStep(input.checkoutId(), step)) {
            log.debug("Step {} already queued for checkout {}", step, input.checkoutId());
            return;
        }
        CheckoutTaskEntity task = new CheckoutTaskEntity();
        task.setId(UUID.randomUUID().toString());
        task.setCheckoutId(input.checkoutId());
        task.setStep(step);
        task.setPayload(serialize(input));
        task.setCreatedAt(clock.instant());
        task.setNextAttemptAt(task.getCreatedAt());
        repository.save(task);
        log.debug("Queued step {} for checkout {}", step, input.checkoutId());
    }

    @Transactional(readOnly = true)
    public List<String> findDue(Instant now, int limit) {
        return repository.findDueTaskIds(CheckoutTaskStatus.PENDING, now, limit);
    }

    /**
     * @return true when this caller now owns the task
     */
    @Transactional
    public boolean claim(String taskId) {
        return repository.claim(taskId, clock.instant(),
                CheckoutTaskStatus.PENDING, CheckoutTaskStatus.PROCESSING) == 1;
    }

    /**
     * Hands a claimed task back without counting the attempt, e.g. when the worker pool is full.
     */
    @Transactional
    public void unclaim(String taskId) {
        repository.unclaim(taskId, CheckoutTaskStatus.PROCESSING, CheckoutTaskStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public Optional<ClaimedTask> findClaimed(String taskId) {
        return repository.findById(taskId)
                .filter(task -> task.getStatus() == CheckoutTaskStatus.PROCESSING)
                .map(task -> new ClaimedTask(task.getId(), task.getCheckoutId(), task.getStep(),
                        task.getPayload(), task.getAttempts()));
    }

    public <T extends CheckoutPayload> T readPayload(ClaimedTask task, Class<T> type) {
        try {
            return objectMapper.readValue(task.payload(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable payload for task " + task.id() + " (" + task.step() + ")", e);
        }
    }

    /**
     * Marks the task processed in the caller's transaction, together with the stage's own writes.
     */
    @Transactional
    public void complete(String taskId) {
        repository.findById(taskId).ifPresent(task -> {
            task.markProcessed(clock.instant());
            repository.save(task);
        });
    }

    @Transactional
    public void reschedule(String taskId, String error, Instant nextAttemptAt) {
        repository.findById(taskId).ifPresent(task -> {
            task.reschedule(error, nextAttemptAt);
            repository.save(task);
        });
    }

    @Transactional
    public void fail(String taskId, String error) {
        repository.findById(taskId).ifPresent(task -> {
            task.markFailed(error, clock.instant());
            repository.save(task);
        });
    }

    /**
     * Returns tasks whose worker has held them since before {@code cutoff} to the queue.
     */
    @Transactional
    public int releaseStale(Instant cutoff) {
        return repository.releaseStale(cutoff, CheckoutTaskStatus.PROCESSING, CheckoutTaskStatus.PENDING);
    }

    @Transactional
    public int purgeProcessedBefore(Instant before) {
        return repository.deleteFinishedBefore(CheckoutTaskStatus.PROCESSED, before);
    }

    @Transactional(readOnly = true)
    public Map<CheckoutTaskStatus, Long> countByStatus() {
        Map<CheckoutTaskStatus, Long> counts = new EnumMap<>(CheckoutTaskStatus.class);
        for (CheckoutTaskStatus status : CheckoutTaskStatus.values()) {
            counts.put(status, repository.countByStatus(status));
        }
        return counts;
    }

    private String serialize(CheckoutPayload input) {
        try {
            return objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload for checkout " + input.checkoutId(), e);
        }
    }

    /**
     * Snapshot of a task owned by the current worker.
     */
    public record ClaimedTask(String id, UUID checkoutId, CheckoutStep step, String payload, int attempts) {
    }
}
