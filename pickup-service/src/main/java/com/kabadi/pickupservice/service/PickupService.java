package com.kabadi.pickupservice.service;

import com.kabadi.pickupservice.dto.CreatePickupRequest;
import com.kabadi.pickupservice.dto.PickupResponse;

import java.util.List;
import java.util.UUID;

public interface PickupService {

    /**
     * Creates a pickup in REQUESTED status.
     * Vendor dispatch starts in the background once the pickup is committed.
     */
    PickupResponse createPickup(CreatePickupRequest request);

    PickupResponse getPickup(UUID pickupId);

    /**
     * Lists a customer's pickups, newest first.
     */
    List<PickupResponse> getCustomerPickups(UUID customerId);

    /**
     * Customer-initiated retry: clears any current offer and restarts dispatch in a new round.
     * Allowed from REQUESTED, FINDING_VENDOR and NO_VENDOR_AVAILABLE.
     */
    PickupResponse retryDispatch(UUID pickupId);

    /**
     * Cancels a pickup that has no vendor yet.
     * Transition: REQUESTED | FINDING_VENDOR -> CANCELLED
     */
    PickupResponse cancelPickup(UUID pickupId);

    /**
     * Transition: ASSIGNED -> ON_THE_WAY, by the assigned vendor only.
     */
    PickupResponse markOnTheWay(UUID pickupId, String vendorRef);

    /**
     * Transition: ON_THE_WAY -> COMPLETED, by the assigned vendor only.
     */
    PickupResponse markCompleted(UUID pickupId, String vendorRef);
}
