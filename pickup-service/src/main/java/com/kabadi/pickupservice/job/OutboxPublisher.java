package com.kabadi.pickupservice.job;

import com.kabadi.pickupservice.config.AmqpConfig;
import com.kabadi.pickupservice.model.OutboxEvent;
import com.kabadi.pickupservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Relays pickup status events from the outbox to {@link AmqpConfig#PICKUP_EXCHANGE}.
 * <p>
 * Events of one pickup go out in the order they were written. When a send fails,
 * the pickup's later events in the same batch are held back until the next run, so
 * consumers never see {@code pickup.assigned} before a {@code pickup.requested}
 * that is still waiting. Each message carries the outbox id as its message id for
 * consumer-side deduplication.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

  static final String PICKUP_ID_HEADER = "x-pickup-id";
  static final Duration RETENTION = Duration.ofDays(1);

  private final OutboxRepository outboxRepository;
  private final RabbitTemplate rabbitTemplate;
  private final Clock clock;

  @Scheduled(fixedDelay = 2000)
  @Transactional
  public void publishOutboxEvents() {
    List<OutboxEvent> events = outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc();
    if (events.isEmpty()) {
      return;
    }

    List<OutboxEvent> published = new ArrayList<>();
    Set<String> blockedPickups = new HashSet<>();

    for (OutboxEvent event : events) {
      String pickupId = event.getAggregateId();
      if (blockedPickups.contains(pickupId)) {
        log.debug("Holding back outbox event behind a failed one: id={}, pickupId={}, type={}",
            event.getId(), pickupId, event.getType());
        continue;
      }
      try {
        rabbitTemplate.send(AmqpConfig.PICKUP_EXCHANGE, event.getType(), toMessage(event));
        event.setProcessed(true);
        published.add(event);
        log.info("Published pickup event: pickupId={}, type={}", pickupId, event.getType());
      } catch (Exception e) {
        blockedPickups.add(pickupId);
        log.error("Failed to publish pickup event, retrying next run: id={}, pickupId={}, type={}",
            event.getId(), pickupId, event.getType(), e);
      }
    }

    if (!published.isEmpty()) {
      outboxRepository.saveAll(published);
    }
    if (!blockedPickups.isEmpty()) {
      log.warn("Outbox run left {} pickups with pending events", blockedPickups.size());
    }
  }

  // Daily at 3 AM
  @Scheduled(cron = "0 0 3 * * *")
  @Transactional
  public void cleanupProcessedEvents() {
    LocalDateTime cutoff = LocalDateTime.now(clock).minus(RETENTION);
    int deleted = outboxRepository.deleteProcessedBefore(cutoff);
    log.info("Purged {} processed pickup events created before {}", deleted, cutoff);
  }

  // Payload is already JSON; no type header, consumers bind on the routing key
  private Message toMessage(OutboxEvent event) {
    return MessageBuilder.withBody(event.getPayload().getBytes(StandardCharsets.UTF_8))
        .setContentType(MessageProperties.CONTENT_TYPE_JSON)
        .setContentEncoding(StandardCharsets.UTF_8.name())
        .setMessageId(event.getId().toString())
        .setType(event.getType())
        .setTimestamp(Date.from(event.getCreatedAt().toInstant(ZoneOffset.UTC)))
        .setHeader(PICKUP_ID_HEADER, event.getAggregateId())
        .build();
  }
}
