package com.dinepos.orderservice.exception;

/**
 * Stable failure categories for order submissions. Callers tell retryable
 * infrastructure trouble apart from bad data by looking at these.
 */
public enum ErrorCategory {

    INVALID_SUBMISSION(true, false),
    ORDER_NOT_FOUND(true, false),
    MISSING_DATA(true, false),
    DUPLICATE_ORDER(true, false),
    INVALID_REFERENCE(true, false),
    INTEGRITY_VIOLATION(true, false),
    CONCURRENT_MODIFICATION(true, true),

    DATABASE_REQUEST(false, false),
    DATABASE_AUTHENTICATION(false, false),
    DATABASE_CONNECTION(false, true),
    DATABASE_TIMEOUT(false, true),
    INTERNAL(false, false);

    private final boolean clientFault;
    private final boolean retryable;

    ErrorCategory(boolean clientFault, boolean retryable) {
        this.clientFault = clientFault;
        this.retryable = retryable;
    }

    public boolean isClientFault() {
        return clientFault;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
