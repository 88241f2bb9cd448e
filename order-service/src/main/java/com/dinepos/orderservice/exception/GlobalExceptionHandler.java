package com.dinepos.orderservice.exception;

import com.dinepos.common.dto.ErrorResponse;
import com.dinepos.common.dto.ValidationErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Every submission failure carries its category, which decides the status code.
     * Client faults are logged at debug, infrastructure faults at error.
     */
    @ExceptionHandler(OrderProcessingException.class)
    public ResponseEntity<ErrorResponse> handleOrderProcessingException(
            OrderProcessingException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        ErrorCategory category = ex.getCategory();
        HttpStatus status = statusFor(category);

        if (category.isClientFault()) {
            log.debug("[{}] Order rejected - Path: {} - Category: {} - {}",
                    correlationId, request.getRequestURI(), category, ex.getMessage());
        } else {
            log.error("[{}] Order processing failed - Path: {} - Category: {} - {}",
                    correlationId, request.getRequestURI(), category, ex.getMessage(), ex);
        }

        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(category.name())
                .retryable(category.isRetryable())
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, status);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        Map<String, String> validationErrors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach(error -> {
            if (error instanceof FieldError fieldError) {
                validationErrors.put(fieldError.getField(), error.getDefaultMessage());
            }
        });

        String correlationId = generateCorrelationId();
        log.debug("[{}] Validation failed - Path: {} - Errors: {}", correlationId, request.getRequestURI(), validationErrors);

        ValidationErrorResponse errorResponse = ValidationErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message("Validation failed")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .validationErrors(validationErrors)
                .errorCode("VALIDATION_FAILED")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableMessage(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();

        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
                .message("Malformed order payload")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(ErrorCategory.INVALID_SUBMISSION.name())
                .retryable(false)
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                correlationId,
                request.getRequestURI(),
                ex.getMessage(),
                ex);
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase())
                .message("An unexpected error occurred. Please contact support if the problem persists.")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(ErrorCategory.INTERNAL.name())
                .retryable(false)
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case ORDER_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_ORDER, CONCURRENT_MODIFICATION -> HttpStatus.CONFLICT;
            case INVALID_SUBMISSION, MISSING_DATA, INVALID_REFERENCE, INTEGRITY_VIOLATION -> HttpStatus.BAD_REQUEST;
            case DATABASE_CONNECTION, DATABASE_TIMEOUT, DATABASE_AUTHENTICATION -> HttpStatus.SERVICE_UNAVAILABLE;
            case DATABASE_REQUEST, INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
