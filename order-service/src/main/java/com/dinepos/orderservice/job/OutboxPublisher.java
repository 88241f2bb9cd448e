package com.dinepos.orderservice.job;

import com.dinepos.orderservice.config.AmqpConfig;
import com.dinepos.orderservice.config.PosConfig;
import com.dinepos.orderservice.model.OutboxEvent;
import com.dinepos.orderservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Relays committed order events to the order exchange. The event type is the routing key.
 */
@Component
@ConditionalOnProperty(prefix = "pos.outbox", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

  private final OutboxRepository outboxRepository;
  private final RabbitTemplate rabbitTemplate;
  private final PosConfig posConfig;

  @Scheduled(fixedDelayString = "${pos.outbox.publish-interval-ms:2000}")
  @Transactional
  public void publishOutboxEvents() {
    List<OutboxEvent> events = outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc();

    if (events.isEmpty()) {
      return;
    }

    log.debug("Found {} outbox events to publish", events.size());

    for (OutboxEvent event : events) {
      try {
        // payload is already JSON, send the bytes as they are
        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        props.setHeader("aggregateId", event.getAggregateId());

        Message message = new Message(event.getPayload().getBytes(StandardCharsets.UTF_8), props);
        rabbitTemplate.send(AmqpConfig.ORDER_EXCHANGE, event.getType(), message);

        event.setProcessed(true);
        event.setPublishedAt(LocalDateTime.now());
        outboxRepository.save(event);

        log.info("Published outbox event: id={}, type={}, orderNo={}", event.getId(), event.getType(),
            event.getAggregateId());

      } catch (Exception e) {
        // left unprocessed, picked up again on the next run
        event.setAttempts(event.getAttempts() + 1);
        outboxRepository.save(event);
        log.error("Failed to publish outbox event: id={}, attempts={}", event.getId(), event.getAttempts(), e);
      }
    }
  }

  @Scheduled(cron = "${pos.outbox.cleanup-cron:0 0 3 * * *}")
  @Transactional
  public void cleanupProcessedEvents() {
    LocalDateTime cutoff = LocalDateTime.now().minusDays(posConfig.getOutbox().getRetentionDays());
    log.info("Starting cleanup of processed outbox events older than {}", cutoff);

    int totalDeleted = 0;
    while (true) {
      List<OutboxEvent> batch = outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(cutoff);
      if (batch.isEmpty()) {
        break;
      }
      outboxRepository.deleteAll(batch);
      totalDeleted += batch.size();
      log.debug("Deleted batch of {} processed events", batch.size());
    }

    log.info("Cleanup completed. Total deleted: {}", totalDeleted);
  }
}
