package com.example.checkout.infrastructure.exception;

/**
 * Exception for service errors that should trigger a retry.
 * Typically thrown for 5xx HTTP errors and network issues.
 */
public class RetryableServiceException extends TransientInfraException {

    private final int statusCode;

    public RetryableServiceException(String serviceName, int statusCode, String message) {
        super(serviceName, message);
        this.statusCode = statusCode;
    }

    public RetryableServiceException(String serviceName, String message, Throwable cause) {
        super(serviceName, message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
