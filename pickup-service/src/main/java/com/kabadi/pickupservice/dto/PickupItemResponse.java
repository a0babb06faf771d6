package com.kabadi.pickupservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
public class PickupItemResponse {
    private UUID id;
    private UUID scrapTypeId;
    private BigDecimal estimatedQuantity;
}
