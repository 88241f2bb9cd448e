package com.dinepos.orderservice.command;

public record UpdateOrderCommand(OrderPayload payload) implements OrderCommand {

    @Override
    public SubmissionStatus status() {
        return SubmissionStatus.UPDATED;
    }

    @Override
    public UpdateOrderCommand withPayload(OrderPayload payload) {
        return new UpdateOrderCommand(payload);
    }
}
