package com.kabadi.pickupservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "pickups", indexes = {
        @Index(name = "idx_pickups_status_expiry", columnList = "status, assignment_expires_at"),
        @Index(name = "idx_pickups_customer", columnList = "customer_id")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class PickupRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    // Customer who created the pickup, null for anonymous requests
    @Column(name = "customer_id")
    private UUID customerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private PickupStatus status;

    @Column(nullable = false)
    private String address;

    private Double latitude;

    private Double longitude;

    @Column(name = "time_slot", nullable = false)
    private String timeSlot;

    @OneToMany(mappedBy = "pickup", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<PickupItem> items = new ArrayList<>();

    // Vendor holding the current offer (FINDING_VENDOR) or the winner (ASSIGNED onwards)
    @Column(name = "assigned_vendor_ref")
    @ToString.Include
    private String assignedVendorRef;

    // Set only while an offer is outstanding
    @Column(name = "assignment_expires_at")
    private Instant assignmentExpiresAt;

    // Incremented on every customer retry; the rejection ledger is scoped to a round
    @Column(name = "dispatch_round", nullable = false)
    private int dispatchRound;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Every conditional transition bumps this, so read-then-write paths can detect interference
    @Version
    @Column(name = "version")
    private Long version;

    public void addItem(PickupItem item) {
        item.setPickup(this);
        item.setPosition(items.size());
        items.add(item);
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
