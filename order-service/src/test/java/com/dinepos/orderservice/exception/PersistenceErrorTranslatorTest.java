package com.dinepos.orderservice.exception;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class PersistenceErrorTranslatorTest {

    private final PersistenceErrorTranslator translator = new PersistenceErrorTranslator();

    private static DataIntegrityViolationException integrity(String sqlState) {
        return new DataIntegrityViolationException("could not execute statement",
                new SQLException("constraint violated", sqlState));
    }

    @Test
    void translate_NotNullViolation_IsMissingData() {
        OrderProcessingException ex = translator.translate(integrity("23502"));

        assertThat(ex).isInstanceOf(OrderIntegrityException.class).hasMessage("Missing required field data");
        assertThat(ex.getCategory()).isEqualTo(ErrorCategory.MISSING_DATA);
        assertThat(ex.getCategory().isClientFault()).isTrue();
    }

    @Test
    void translate_UniqueViolation_IsDuplicateOrder() {
        OrderProcessingException ex = translator.translate(integrity("23505"));

        assertThat(ex.getCategory()).isEqualTo(ErrorCategory.DUPLICATE_ORDER);
        assertThat(ex).hasMessage("Duplicate order number detected");
    }

    @Test
    void translate_DuplicateLineNumber_NamesTheLineClash() {
        DataIntegrityViolationException ex = new DataIntegrityViolationException("could not execute statement",
                new SQLException("ERROR: duplicate key value violates unique constraint \"uk_order_line_sl_no\"",
                        "23505"));

        OrderProcessingException translated = translator.translate(ex);

        assertThat(translated.getCategory()).isEqualTo(ErrorCategory.DUPLICATE_ORDER);
        assertThat(translated).hasMessage("Duplicate line number (slNo) in order items");
    }

    @Test
    void translate_ForeignKeyViolation_IsInvalidReference() {
        assertThat(translator.translate(integrity("23503")).getCategory()).isEqualTo(ErrorCategory.INVALID_REFERENCE);
    }

    @Test
    void translate_AuthenticationFailure() {
        OrderProcessingException ex = translator.translate(new DataAccessResourceFailureException("login failed",
                new SQLException("password authentication failed", "28P01")));

        assertThat(ex).isInstanceOf(DatabaseUnavailableException.class);
        assertThat(ex.getCategory()).isEqualTo(ErrorCategory.DATABASE_AUTHENTICATION);
        assertThat(ex.getCategory().isRetryable()).isFalse();
    }

    @Test
    void translate_ConnectionReset_IsRetryable() {
        OrderProcessingException ex = translator.translate(new DataAccessResourceFailureException("I/O error",
                new SQLException("connection reset", "08006")));

        assertThat(ex.getCategory()).isEqualTo(ErrorCategory.DATABASE_CONNECTION);
        assertThat(ex.getCategory().isRetryable()).isTrue();
        assertThat(ex).hasMessage("Database connection was reset");
    }

    @Test
    void translate_Timeout_IsRetryable() {
        OrderProcessingException ex = translator.translate(new QueryTimeoutException("statement timeout"));

        assertThat(ex.getCategory()).isEqualTo(ErrorCategory.DATABASE_TIMEOUT);
        assertThat(ex.getCategory().isClientFault()).isFalse();
        assertThat(ex.getCategory().isRetryable()).isTrue();
    }

    @Test
    void translate_OtherDataAccessFailure_IsDatabaseRequest() {
        OrderProcessingException ex = translator.translate(new InvalidDataAccessResourceUsageException("bad grammar"));

        assertThat(ex).isInstanceOf(DatabaseRequestException.class)
                .isNotInstanceOf(DatabaseUnavailableException.class);
        assertThat(ex.getCategory()).isEqualTo(ErrorCategory.DATABASE_REQUEST);
        assertThat(ex.getCategory().isRetryable()).isFalse();
        assertThat(ex).hasMessage("Database request error: bad grammar");
    }

    @Test
    void translate_VersionClash_IsConcurrentModification() {
        OrderProcessingException ex = translator.translate(new OptimisticLockingFailureException("stale"));

        assertThat(ex.getCategory()).isEqualTo(ErrorCategory.CONCURRENT_MODIFICATION);
    }

    @Test
    void translate_ProcessingExceptionPassesThrough() {
        OrderNotFoundException notFound = new OrderNotFoundException(1);

        assertThat(translator.translate(notFound)).isSameAs(notFound);
    }

    @Test
    void translate_AnythingElse_IsInternal() {
        OrderProcessingException ex = translator.translate(new IllegalStateException("boom"));

        assertThat(ex.getCategory()).isEqualTo(ErrorCategory.INTERNAL);
        assertThat(ex).hasMessage("Order processing failed: boom").hasCauseInstanceOf(IllegalStateException.class);
    }
}
