package com.dinepos.orderservice.service;

import com.dinepos.orderservice.command.OrderCommand;

/**
 * A committed submission: the command as processed (customer id resolved)
 * and what was written for it.
 */
public record SubmissionResult(OrderCommand command, PersistedOrder persisted) {

    public int orderNo() {
        return persisted.orderNo();
    }

    public int customerId() {
        return command.payload().customerId();
    }
}
