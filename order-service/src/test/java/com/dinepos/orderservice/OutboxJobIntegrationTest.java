package com.dinepos.orderservice;

import com.dinepos.orderservice.config.AmqpConfig;
import com.dinepos.orderservice.job.OutboxPublisher;
import com.dinepos.orderservice.model.OutboxEvent;
import com.dinepos.orderservice.repository.OutboxRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class OutboxJobIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxRepository outboxRepository;

    @Autowired
    private BlockingQueue<Message> capturedMessages;

    @BeforeEach
    @AfterEach
    void clear() {
        outboxRepository.deleteAll();
        capturedMessages.clear();
    }

    // listens on every order event the service emits
    @TestConfiguration
    static class OrderEventSpyConfig {

        @Bean
        public BlockingQueue<Message> capturedMessages() {
            return new LinkedBlockingQueue<>();
        }

        @Bean
        public Queue spyQueue() {
            return new Queue("spy.order.events", false);
        }

        @Bean
        public Binding spyBinding(Queue spyQueue) {
            return BindingBuilder.bind(spyQueue)
                    .to(new TopicExchange(AmqpConfig.ORDER_EXCHANGE))
                    .with("order.#");
        }

        @Bean
        public SpyListener spyListener(BlockingQueue<Message> capturedMessages) {
            return new SpyListener(capturedMessages);
        }

        static class SpyListener {
            private final BlockingQueue<Message> queue;

            SpyListener(BlockingQueue<Message> queue) {
                this.queue = queue;
            }

            @RabbitListener(queues = "spy.order.events")
            public void onMessage(Message msg) {
                queue.offer(msg);
            }
        }
    }

    private static OutboxEvent event(String orderNo, String type, LocalDateTime createdAt, boolean processed) {
        return OutboxEvent.builder()
                .aggregateType("ORDER")
                .aggregateId(orderNo)
                .type(type)
                .payload("{\"orderNo\": " + orderNo + ", \"status\": \"KOT\"}")
                .createdAt(createdAt)
                .processed(processed)
                .build();
    }

    @Test
    void should_publish_pending_events_and_mark_processed() throws InterruptedException {
        OutboxEvent event = outboxRepository.save(event("1050", AmqpConfig.ROUTING_KEY_KOT_SENT,
                LocalDateTime.now(), false));

        outboxPublisher.publishOutboxEvents();

        Message msg = capturedMessages.poll(5, TimeUnit.SECONDS);
        assertNotNull(msg, "Message should be published to RabbitMQ");
        assertEquals(AmqpConfig.ROUTING_KEY_KOT_SENT, msg.getMessageProperties().getReceivedRoutingKey());
        assertEquals("1050", msg.getMessageProperties().getHeader("aggregateId"));
        assertTrue(new String(msg.getBody(), StandardCharsets.UTF_8).contains("\"orderNo\""));

        var updatedEvent = outboxRepository.findById(event.getId()).orElseThrow();
        assertTrue(updatedEvent.isProcessed(), "Event should be marked as processed");
        assertNotNull(updatedEvent.getPublishedAt());
        assertEquals(0, updatedEvent.getAttempts());
    }

    @Test
    void should_cleanup_old_processed_events() {
        OutboxEvent oldEvent = outboxRepository.save(event("1", AmqpConfig.ROUTING_KEY_ORDER_CREATED,
                LocalDateTime.now().minusDays(2), true));
        OutboxEvent newEvent = outboxRepository.save(event("2", AmqpConfig.ROUTING_KEY_ORDER_CREATED,
                LocalDateTime.now().minusHours(1), true));
        OutboxEvent pendingEvent = outboxRepository.save(event("3", AmqpConfig.ROUTING_KEY_ORDER_UPDATED,
                LocalDateTime.now().minusDays(2), false));

        outboxPublisher.cleanupProcessedEvents();

        assertTrue(outboxRepository.findById(oldEvent.getId()).isEmpty(), "Old processed event should be deleted");
        assertTrue(outboxRepository.findById(newEvent.getId()).isPresent(), "Recent event should be kept");
        assertTrue(outboxRepository.findById(pendingEvent.getId()).isPresent(), "Pending event should be kept regardless of age");
    }
}
