package com.example.checkout.infrastructure.config;

import com.example.checkout.infrastructure.persistence.entity.CheckoutTaskStatus;
import com.example.checkout.infrastructure.pipeline.CheckoutTaskQueue;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actuator endpoint exposing in-flight stage executions and queue depth.
 * Useful for monitoring during graceful shutdown.
 */
@Component
@Endpoint(id = "checkoutpipeline")
public class CheckoutPipelineEndpoint {

    private final GracefulShutdownConfig gracefulShutdownConfig;
    private final CheckoutTaskQueue taskQueue;

    public CheckoutPipelineEndpoint(GracefulShutdownConfig gracefulShutdownConfig, CheckoutTaskQueue taskQueue) {
        this.gracefulShutdownConfig = gracefulShutdownConfig;
        this.taskQueue = taskQueue;
    }

    @ReadOperation
    public Map<String, Object> pipeline() {
        Map<String, Long> tasks = new LinkedHashMap<>();
        for (Map.Entry<CheckoutTaskStatus, Long> entry : taskQueue.countByStatus().entrySet()) {
            tasks.put(entry.getKey().name(), entry.getValue());
        }
        int active = gracefulShutdownConfig.getActiveStageCount();
        return Map.of(
                "activeStages", active,
                "status", active > 0 ? "BUSY" : "IDLE",
                "tasks", tasks
        );
    }
}
