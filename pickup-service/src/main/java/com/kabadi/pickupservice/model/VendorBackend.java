package com.kabadi.pickupservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Presence record a vendor backend keeps fresh by posting its location and offer URL.
 */
@Entity
@Table(name = "vendor_backends")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VendorBackend {

    @Id
    @Column(name = "vendor_ref")
    @ToString.Include
    private String vendorRef;

    private Double latitude;

    private Double longitude;

    // Where offers are POSTed
    @Column(name = "offer_url")
    private String offerUrl;

    @Builder.Default
    @Column(name = "is_available", nullable = false)
    @ToString.Include
    private Boolean isAvailable = true;

    @Column(name = "last_seen_at")
    private Instant lastSeenAt;
}
