package com.kabadi.pickupservice.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kabadi.common.contracts.PickupStatusChangeContract;
import com.kabadi.pickupservice.config.AmqpConfig;
import com.kabadi.pickupservice.model.OutboxEvent;
import com.kabadi.pickupservice.model.PickupRequest;
import com.kabadi.pickupservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Listens to pickup status changes and saves them to the Outbox table.
 *
 * The OutboxPublisher job will later pick up these events and send them to
 * RabbitMQ.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PickupEventListener {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Handles status change events synchronously within the transaction.
     */
    @EventListener
    public void handlePickupStatusChangedEvent(PickupStatusChangedEvent event) {
        PickupRequest pickup = event.getPickup();
        String routingKey = AmqpConfig.ROUTING_KEY_PREFIX + pickup.getStatus().name().toLowerCase(Locale.ROOT);
        try {
            PickupStatusChangeContract contract = PickupStatusChangeContract.builder()
                    .pickupId(pickup.getId())
                    .customerId(pickup.getCustomerId())
                    .status(pickup.getStatus().name())
                    .assignedVendorRef(pickup.getAssignedVendorRef())
                    .address(pickup.getAddress())
                    .timeSlot(pickup.getTimeSlot())
                    .occurredAt(Instant.now(clock))
                    .build();

            saveOutboxEvent(pickup.getId().toString(), routingKey, contract);

            log.info("Saved pickup status event to Outbox: pickupId={}, routingKey={}", pickup.getId(), routingKey);

        } catch (Exception e) {
            log.error("Failed to save pickup status event to Outbox: pickupId={}", pickup.getId(), e);
            // Throwing exception here will rollback the transaction
            throw new IllegalStateException("Failed to save outbox event", e);
        }
    }

    private void saveOutboxEvent(String aggregateId, String type, Object payloadObj) throws Exception {
        String payload = objectMapper.writeValueAsString(payloadObj);
        OutboxEvent outboxEvent = OutboxEvent.builder()
                .aggregateType("PICKUP")
                .aggregateId(aggregateId)
                .type(type)
                .payload(payload)
                .createdAt(LocalDateTime.now(clock))
                .processed(false)
                .build();
        outboxRepository.save(outboxEvent);
    }
}
