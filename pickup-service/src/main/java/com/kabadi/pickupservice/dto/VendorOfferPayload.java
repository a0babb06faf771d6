package com.kabadi.pickupservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Body POSTed to a vendor's offer URL. The vendor answers later through
 * /api/v1/vendor/accept or /api/v1/vendor/reject before {@code offerExpiresAt}.
 */
@Data
@Builder
public class VendorOfferPayload {
    private UUID pickupId;
    private String vendorRef;
    private String address;
    private Double latitude;
    private Double longitude;
    private String timeSlot;
    private List<VendorOfferItem> items;
    private Instant offerExpiresAt;
}
