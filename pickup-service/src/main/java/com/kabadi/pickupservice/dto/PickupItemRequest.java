package com.kabadi.pickupservice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
public class PickupItemRequest {
    @NotNull(message = "scrapTypeId cannot be null")
    private UUID scrapTypeId;

    @NotNull(message = "estimatedQuantity cannot be null")
    @DecimalMin(value = "0.0", inclusive = false, message = "estimatedQuantity must be greater than 0")
    private BigDecimal estimatedQuantity;
}
