package com.kabadi.pickupservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Canonical body of every vendor callback (accept, reject, on-the-way, complete).
 * Vendor backends in the wild use several spellings for the same two fields; they are
 * folded into this one shape here so nothing past the controller sees an alias.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VendorCallbackRequest {

    @NotNull(message = "pickupId is required (accepted keys: pickupId, pickup_id, request_id, requestId)")
    @JsonAlias({"pickup_id", "request_id", "requestId"})
    private UUID pickupId;

    @NotBlank(message = "vendorRef is required (accepted keys: vendorRef, assignedVendorRef, vendor_id, vendorId)")
    @JsonAlias({"assignedVendorRef", "vendor_id", "vendorId"})
    private String vendorRef;
}
