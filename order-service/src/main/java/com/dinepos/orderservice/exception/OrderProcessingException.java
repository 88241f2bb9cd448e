package com.dinepos.orderservice.exception;

/**
 * Base for every failure an order submission reports to its caller.
 */
public class OrderProcessingException extends RuntimeException {

    private final ErrorCategory category;

    public OrderProcessingException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public OrderProcessingException(String message, ErrorCategory category, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
