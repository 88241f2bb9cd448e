package com.dinepos.orderservice.exception;

/**
 * Exception thrown when the database rejects order data
 * (missing required value, duplicate key, unknown reference)
 * HTTP Status: 400 Bad Request or 409 Conflict
 */
public class OrderIntegrityException extends OrderProcessingException {

    public OrderIntegrityException(String message, ErrorCategory category, Throwable cause) {
        super(message, category, cause);
    }
}
