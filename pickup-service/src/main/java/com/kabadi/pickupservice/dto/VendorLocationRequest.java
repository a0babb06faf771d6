package com.kabadi.pickupservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class VendorLocationRequest {

    @NotBlank(message = "vendorRef is required (accepted keys: vendorRef, vendor_id, vendorId)")
    @JsonAlias({"vendor_id", "vendorId"})
    private String vendorRef;

    @NotNull(message = "latitude is required")
    @DecimalMin(value = "-90.0", message = "latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "latitude must be between -90 and 90")
    private Double latitude;

    @NotNull(message = "longitude is required")
    @DecimalMin(value = "-180.0", message = "longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "longitude must be between -180 and 180")
    private Double longitude;

    // Omitted on pure location pings; the stored URL is kept
    @JsonAlias("offer_url")
    private String offerUrl;
}
