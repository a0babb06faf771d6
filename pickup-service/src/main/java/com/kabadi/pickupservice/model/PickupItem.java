package com.kabadi.pickupservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "pickup_items")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class PickupItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pickup_id", nullable = false)
    private PickupRequest pickup;

    // Reference into the scrap type catalogue (managed by the admin service)
    @Column(name = "scrap_type_id", nullable = false)
    @ToString.Include
    private UUID scrapTypeId;

    @Column(name = "estimated_quantity", nullable = false, precision = 12, scale = 3)
    private BigDecimal estimatedQuantity;

    // Keeps the order in which the customer listed the items
    @Column(nullable = false)
    private int position;
}
