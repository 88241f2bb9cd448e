package com.dinepos.orderservice.exception;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Maps whatever escaped a submission onto the {@link ErrorCategory} taxonomy,
 * so raw driver errors never reach the caller.
 */
@Component
public class PersistenceErrorTranslator {

    // unique (order_no, sl_no) on order_line
    static final String ORDER_LINE_SL_NO_CONSTRAINT = "uk_order_line_sl_no";

    public OrderProcessingException translate(RuntimeException ex) {
        if (ex instanceof OrderProcessingException processingException) {
            return processingException;
        }
        if (ex instanceof DataIntegrityViolationException integrityViolation) {
            return translateIntegrityViolation(integrityViolation);
        }
        if (ex instanceof OptimisticLockingFailureException) {
            return new OrderIntegrityException(
                    "The order was modified by another register. Please reload it and resubmit.",
                    ErrorCategory.CONCURRENT_MODIFICATION, ex);
        }
        if (ex instanceof QueryTimeoutException
                || ex instanceof TransactionTimedOutException
                || ex instanceof CannotAcquireLockException
                || ex instanceof PessimisticLockingFailureException) {
            return new DatabaseUnavailableException("Database operation timed out",
                    ErrorCategory.DATABASE_TIMEOUT, ex);
        }
        if (ex instanceof DataAccessResourceFailureException
                || ex instanceof TransientDataAccessResourceException
                || ex instanceof CannotCreateTransactionException) {
            return translateResourceFailure(ex);
        }
        if (ex instanceof DataAccessException || ex instanceof TransactionException) {
            return new DatabaseRequestException("Database request error: " + ex.getMessage(), ex);
        }
        return new OrderProcessingException(
                "Order processing failed: " + (ex.getMessage() != null ? ex.getMessage() : "Unknown error"),
                ErrorCategory.INTERNAL, ex);
    }

    private OrderProcessingException translateIntegrityViolation(DataIntegrityViolationException ex) {
        String sqlState = sqlState(ex);
        String message = String.valueOf(NestedExceptionUtils.getMostSpecificCause(ex).getMessage())
                .toLowerCase(Locale.ROOT);

        if ("23502".equals(sqlState) || message.contains("null value") || message.contains("cannot insert null")) {
            return new OrderIntegrityException("Missing required field data", ErrorCategory.MISSING_DATA, ex);
        }
        if (ex instanceof DuplicateKeyException || "23505".equals(sqlState)
                || message.contains("duplicate key") || message.contains("violation of primary key")) {
            if (message.contains(ORDER_LINE_SL_NO_CONSTRAINT)) {
                return new OrderIntegrityException("Duplicate line number (slNo) in order items",
                        ErrorCategory.DUPLICATE_ORDER, ex);
            }
            return new OrderIntegrityException("Duplicate order number detected", ErrorCategory.DUPLICATE_ORDER, ex);
        }
        if ("23503".equals(sqlState) || message.contains("foreign key")) {
            return new OrderIntegrityException("Invalid reference data provided", ErrorCategory.INVALID_REFERENCE, ex);
        }
        return new OrderIntegrityException("Order data violates a database constraint",
                ErrorCategory.INTEGRITY_VIOLATION, ex);
    }

    private OrderProcessingException translateResourceFailure(RuntimeException ex) {
        String sqlState = sqlState(ex);
        if (sqlState != null && sqlState.startsWith("28")) {
            return new DatabaseUnavailableException("Database authentication failed",
                    ErrorCategory.DATABASE_AUTHENTICATION, ex);
        }
        if (sqlState != null && sqlState.startsWith("08")) {
            return new DatabaseUnavailableException("Database connection was reset",
                    ErrorCategory.DATABASE_CONNECTION, ex);
        }
        return new DatabaseUnavailableException("Database connection failed: " + ex.getMessage(),
                ErrorCategory.DATABASE_CONNECTION, ex);
    }

    private static String sqlState(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return sqlException.getSQLState();
            }
            current = current.getCause();
        }
        return null;
    }
}
