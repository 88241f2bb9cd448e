package com.dinepos.orderservice.command;

public record KotCommand(OrderPayload payload) implements OrderCommand {

    @Override
    public SubmissionStatus status() {
        return SubmissionStatus.KOT;
    }

    @Override
    public KotCommand withPayload(OrderPayload payload) {
        return new KotCommand(payload);
    }
}
