package com.example.checkout.infrastructure.exception;

/**
 * Base type for infrastructure failures that may succeed when the same work is attempted again later.
 * Pipeline stages failing with one of these are rescheduled with backoff.
 */
public abstract class TransientInfraException extends RuntimeException {

    private final String serviceName;

    protected TransientInfraException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    protected TransientInfraException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
