package com.dinepos.orderservice.service;

import com.dinepos.orderservice.command.OrderCommand;
import com.dinepos.orderservice.exception.PersistenceErrorTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * Runs one submission as a single unit of work: customer resolution, the
 * workflow writes and the outbox event commit together or not at all.
 * <p>
 * A failed rollback is logged and never replaces the error that caused it.
 * Every failure leaves as an {@link com.dinepos.orderservice.exception.OrderProcessingException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderTransactionCoordinator {

    private final PlatformTransactionManager transactionManager;
    private final CustomerResolver customerResolver;
    private final OrderPersistenceEngine persistenceEngine;
    private final OrderEventRecorder eventRecorder;
    private final PersistenceErrorTranslator errorTranslator;

    public SubmissionResult execute(OrderCommand command) {
        DefaultTransactionDefinition definition = new DefaultTransactionDefinition(
                TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        definition.setName("order-submission-" + command.status());

        TransactionStatus transaction;
        try {
            transaction = transactionManager.getTransaction(definition);
        } catch (RuntimeException ex) {
            throw errorTranslator.translate(ex);
        }
        log.debug("Transaction started. status={}, orderNo={}", command.status(), command.payload().orderNo());

        SubmissionResult result;
        try {
            int customerId = customerResolver.resolve(command.payload());
            OrderCommand resolved = command.withPayload(command.payload().withCustomerId(customerId));

            PersistedOrder persisted = persistenceEngine.persist(resolved);
            eventRecorder.record(resolved, persisted);
            result = new SubmissionResult(resolved, persisted);
        } catch (RuntimeException ex) {
            rollback(transaction, ex);
            throw errorTranslator.translate(ex);
        } catch (Error err) {
            rollback(transaction, err);
            throw err;
        }

        try {
            transactionManager.commit(transaction);
        } catch (RuntimeException ex) {
            log.error("Commit failed. status={}, orderNo={}", command.status(), result.orderNo(), ex);
            throw errorTranslator.translate(ex);
        }

        log.info("Transaction committed. status={}, orderNo={}, custId={}",
                command.status(), result.orderNo(), result.customerId());
        return result;
    }

    private void rollback(TransactionStatus transaction, Throwable cause) {
        if (transaction.isCompleted()) {
            return;
        }
        try {
            transactionManager.rollback(transaction);
            log.info("Transaction rolled back. cause={}", cause.toString());
        } catch (RuntimeException rollbackEx) {
            log.error("Rollback failed, original error is rethrown", rollbackEx);
            cause.addSuppressed(rollbackEx);
        }
    }
}
