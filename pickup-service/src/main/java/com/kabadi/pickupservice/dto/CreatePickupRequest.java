package com.kabadi.pickupservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
public class CreatePickupRequest {

    // Optional until customer authentication is wired in front of this service
    private UUID customerId;

    @NotBlank(message = "address is required")
    private String address;

    // Geolocation is optional, but when given it must be a real coordinate
    @DecimalMin(value = "-90.0", message = "latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "latitude must be between -90 and 90")
    private Double latitude;

    @DecimalMin(value = "-180.0", message = "longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "longitude must be between -180 and 180")
    private Double longitude;

    @NotBlank(message = "timeSlot is required")
    private String timeSlot;

    @NotEmpty(message = "items is required (array of { scrapTypeId, estimatedQuantity })")
    @Valid
    private List<PickupItemRequest> items;
}
