package com.kabadi.pickupservice.dto;

import com.kabadi.pickupservice.model.PickupStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Pickup projection returned after every successful transition.
 */
@Data
@Builder
public class PickupResponse {
    private UUID id;
    private UUID customerId;
    private PickupStatus status;
    private String address;
    private Double latitude;
    private Double longitude;
    private String timeSlot;
    private String assignedVendorRef;
    private Instant assignmentExpiresAt;
    private Instant cancelledAt;
    private Instant completedAt;
    private Instant createdAt;
    private List<PickupItemResponse> items;
}
