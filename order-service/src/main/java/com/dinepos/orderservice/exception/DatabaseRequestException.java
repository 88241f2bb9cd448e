package com.dinepos.orderservice.exception;

/**
 * Exception thrown when the database rejects a request it could otherwise serve
 * (bad statement, unexpected data access failure). Not retryable.
 * HTTP Status: 500 Internal Server Error
 */
public class DatabaseRequestException extends OrderProcessingException {

    public DatabaseRequestException(String message, Throwable cause) {
        super(message, ErrorCategory.DATABASE_REQUEST, cause);
    }
}
