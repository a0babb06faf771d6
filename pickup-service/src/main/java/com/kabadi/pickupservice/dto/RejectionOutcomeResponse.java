package com.kabadi.pickupservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * Result of a vendor rejection. {@code ignored} is true when the vendor did not hold
 * the current offer (stale or duplicate callback); nothing changed in that case.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RejectionOutcomeResponse {
    private UUID pickupId;
    private String vendorRef;
    private boolean ignored;
    private PickupResponse pickup; // state after redispatch, absent when ignored

    public static RejectionOutcomeResponse ignored(UUID pickupId, String vendorRef) {
        return RejectionOutcomeResponse.builder()
                .pickupId(pickupId)
                .vendorRef(vendorRef)
                .ignored(true)
                .build();
    }
}
