package com.kabadi.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Event contract published by pickup-service whenever a pickup reaches a state
 * that customers or vendors care about (created, assigned, no vendor available,
 * cancelled, on the way, completed).
 * Routing key is "pickup." + lower-cased status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PickupStatusChangeContract {
    private UUID pickupId;
    private UUID customerId;
    private String status;
    private String assignedVendorRef; // null unless a vendor holds the pickup
    private String address;
    private String timeSlot;
    private Instant occurredAt;
}
