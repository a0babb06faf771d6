package com.kabadi.pickupservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class VendorLocationResponse {
    private String vendorRef;
    private Boolean isAvailable;
    private Instant lastSeenAt;
}
