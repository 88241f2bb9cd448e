package com.dinepos.orderservice.exception;

/**
 * Exception thrown when a submission cannot be processed as sent
 * For example: an unknown status value
 * HTTP Status: 400 Bad Request
 */
public class InvalidOrderSubmissionException extends OrderProcessingException {

    public InvalidOrderSubmissionException(String message) {
        super(message, ErrorCategory.INVALID_SUBMISSION);
    }
}
