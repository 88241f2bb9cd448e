package com.dinepos.orderservice.command;

/**
 * @param heldOrderNo draft order to purge after the save, or null
 */
public record NewOrderCommand(OrderPayload payload, Integer heldOrderNo) implements OrderCommand {

    @Override
    public SubmissionStatus status() {
        return SubmissionStatus.NEW;
    }

    @Override
    public NewOrderCommand withPayload(OrderPayload payload) {
        return new NewOrderCommand(payload, heldOrderNo);
    }
}
