package com.dinepos.orderservice.command;

/**
 * One order submission, typed by workflow.
 */
public sealed interface OrderCommand permits NewOrderCommand, UpdateOrderCommand, KotCommand {

    OrderPayload payload();

    SubmissionStatus status();

    /**
     * Same command carrying a different payload, e.g. once the customer id is resolved.
     */
    OrderCommand withPayload(OrderPayload payload);
}
