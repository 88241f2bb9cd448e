package com.dinepos.orderservice.service;

import com.dinepos.common.contracts.OrderSubmittedContract;
import com.dinepos.orderservice.command.OrderCommand;
import com.dinepos.orderservice.command.OrderPayload;
import com.dinepos.orderservice.config.AmqpConfig;
import com.dinepos.orderservice.config.PosConfig;
import com.dinepos.orderservice.exception.ErrorCategory;
import com.dinepos.orderservice.exception.OrderProcessingException;
import com.dinepos.orderservice.model.OutboxEvent;
import com.dinepos.orderservice.repository.OutboxRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Writes the submission's event to the outbox inside the same transaction,
 * so an event exists exactly when the order commits.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderEventRecorder {

    static final String AGGREGATE_TYPE = "ORDER";

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final PosConfig posConfig;

    public void record(OrderCommand command, PersistedOrder persisted) {
        if (!posConfig.getOutbox().isEnabled()) {
            return;
        }

        OrderPayload payload = command.payload();
        String type = routingKey(command);

        OrderSubmittedContract contract = OrderSubmittedContract.builder()
                .orderNo(persisted.orderNo())
                .status(command.status().name())
                .orderType(payload.orderType().getLabel())
                .customerId(payload.customerId())
                .tableId(payload.tableId())
                .tableNo(payload.tableNo())
                .seatIds(persisted.claimedSeats())
                .itemsCount(payload.items().size())
                .total(payload.total())
                .printJobs(persisted.printJobs().stream()
                        .map(job -> OrderSubmittedContract.PrintJob.builder()
                                .slNo(job.getSlNo())
                                .itemId(job.getItemId())
                                .printer(job.getPrinter())
                                .build())
                        .toList())
                .submittedAt(Instant.now())
                .build();

        try {
            OutboxEvent event = OutboxEvent.builder()
                    .aggregateType(AGGREGATE_TYPE)
                    .aggregateId(String.valueOf(persisted.orderNo()))
                    .type(type)
                    .payload(objectMapper.writeValueAsString(contract))
                    .createdAt(LocalDateTime.now())
                    .processed(false)
                    .build();
            outboxRepository.save(event);
        } catch (JsonProcessingException e) {
            log.error("ERROR occurred while serializing outbox event. orderNo={}, type={}", persisted.orderNo(), type);
            throw new OrderProcessingException("Failed to record order event", ErrorCategory.INTERNAL, e);
        }

        log.info("'{}' event saved to Outbox. orderNo={}", type, persisted.orderNo());
    }

    static String routingKey(OrderCommand command) {
        return switch (command.status()) {
            case NEW -> AmqpConfig.ROUTING_KEY_ORDER_CREATED;
            case UPDATED -> AmqpConfig.ROUTING_KEY_ORDER_UPDATED;
            case KOT -> AmqpConfig.ROUTING_KEY_KOT_SENT;
        };
    }
}
