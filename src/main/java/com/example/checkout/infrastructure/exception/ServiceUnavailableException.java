package com.example.checkout.infrastructure.exception;

/**
 * Thrown when a downstream service is still failing after all client-side retries.
 * The checkout pipeline treats it as transient and reschedules the stage.
 */
public class ServiceUnavailableException extends TransientInfraException {

    public ServiceUnavailableException(String serviceName, String message) {
        super(serviceName, message);
    }

    public ServiceUnavailableException(String serviceName, String message, Throwable cause) {
        super(serviceName, message, cause);
    }
}
