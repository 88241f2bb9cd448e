package com.dinepos.orderservice.exception;

/**
 * Exception thrown when the database cannot serve the submission
 * (login failure, connection reset, timeout)
 * HTTP Status: 503 Service Unavailable
 */
public class DatabaseUnavailableException extends OrderProcessingException {

    public DatabaseUnavailableException(String message, ErrorCategory category, Throwable cause) {
        super(message, category, cause);
    }
}
