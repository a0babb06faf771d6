package com.kabadi.pickupservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only entry in the rejection ledger. Never updated or deleted.
 */
@Entity
@Table(name = "pickup_rejections", indexes = {
        @Index(name = "idx_rejections_pickup_round", columnList = "pickup_id, dispatch_round")
})
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RejectionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "pickup_id", nullable = false)
    private UUID pickupId;

    @Column(name = "vendor_ref", nullable = false)
    private String vendorRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RejectionReason reason;

    @Column(name = "dispatch_round", nullable = false)
    private int dispatchRound;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
