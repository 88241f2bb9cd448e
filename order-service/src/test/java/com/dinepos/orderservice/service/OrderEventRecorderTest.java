package com.dinepos.orderservice.service;

import com.dinepos.common.contracts.OrderSubmittedContract;
import com.dinepos.orderservice.command.KotCommand;
import com.dinepos.orderservice.command.NewOrderCommand;
import com.dinepos.orderservice.command.OrderPayload;
import com.dinepos.orderservice.command.UpdateOrderCommand;
import com.dinepos.orderservice.config.PosConfig;
import com.dinepos.orderservice.model.OrderType;
import com.dinepos.orderservice.model.OutboxEvent;
import com.dinepos.orderservice.model.PrintChannel;
import com.dinepos.orderservice.model.PrinterAssignment;
import com.dinepos.orderservice.repository.OutboxRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderEventRecorderTest {

    @Mock
    private OutboxRepository outboxRepository;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private PosConfig posConfig;
    private OrderEventRecorder recorder;
    private OrderPayload payload;

    @BeforeEach
    void setUp() {
        posConfig = new PosConfig();
        recorder = new OrderEventRecorder(outboxRepository, objectMapper, posConfig);
        payload = new OrderPayload(0, "2024-05-01", "19:45", OrderType.DINE_IN, 15, "Maya", "", "", "5551234567",
                0, 5, "T5", "", new BigDecimal("29.00"), "", List.of(), List.of(12));
    }

    @Test
    void record_NewOrder_SavesCreatedEventWithPrintJobs() throws Exception {
        PrinterAssignment job = PrinterAssignment.builder()
                .orderNo(1050).slNo(1).itemId(101).printer("BarPrinter").channel(PrintChannel.ORDER).build();

        recorder.record(new NewOrderCommand(payload, null), new PersistedOrder(1050, List.of(12), List.of(job)));

        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxRepository).save(captor.capture());
        OutboxEvent event = captor.getValue();
        assertThat(event.getType()).isEqualTo("order.created");
        assertThat(event.getAggregateType()).isEqualTo("ORDER");
        assertThat(event.getAggregateId()).isEqualTo("1050");
        assertThat(event.isProcessed()).isFalse();

        OrderSubmittedContract contract = objectMapper.readValue(event.getPayload(), OrderSubmittedContract.class);
        assertThat(contract.getOrderNo()).isEqualTo(1050);
        assertThat(contract.getStatus()).isEqualTo("NEW");
        assertThat(contract.getOrderType()).isEqualTo("DineIn");
        assertThat(contract.getSeatIds()).containsExactly(12);
        assertThat(contract.getPrintJobs()).singleElement()
                .satisfies(p -> assertThat(p.getPrinter()).isEqualTo("BarPrinter"));
    }

    @Test
    void routingKey_FollowsWorkflow() {
        assertThat(OrderEventRecorder.routingKey(new UpdateOrderCommand(payload))).isEqualTo("order.updated");
        assertThat(OrderEventRecorder.routingKey(new KotCommand(payload))).isEqualTo("order.kot.sent");
    }

    @Test
    void record_OutboxDisabled_WritesNothing() {
        posConfig.getOutbox().setEnabled(false);

        recorder.record(new KotCommand(payload), new PersistedOrder(1050, List.of(), List.of()));

        verifyNoInteractions(outboxRepository);
    }
}
