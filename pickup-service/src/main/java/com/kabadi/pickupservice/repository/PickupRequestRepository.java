package com.kabadi.pickupservice.repository;

import com.kabadi.pickupservice.model.PickupRequest;
import com.kabadi.pickupservice.model.PickupStatus;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every state change of a pickup goes through one of the conditional UPDATEs below.
 * Each returns the number of rows changed: 1 means this caller won, 0 means the
 * row no longer matched (someone else got there first) and nothing was written.
 * Callers MUST run inside a transaction.
 */
@Repository
public interface PickupRequestRepository extends JpaRepository<PickupRequest, UUID> {

    @Query("SELECT p FROM PickupRequest p LEFT JOIN FETCH p.items WHERE p.id = :id")
    Optional<PickupRequest> findWithItemsById(@Param("id") UUID id);

    @EntityGraph(attributePaths = "items")
    List<PickupRequest> findByCustomerIdOrderByCreatedAtDesc(UUID customerId);

    // Backlog for the reconciliation sweep, oldest expiry first
    List<PickupRequest> findTop100ByStatusAndAssignmentExpiresAtBeforeOrderByAssignmentExpiresAtAsc(
            PickupStatus status, Instant now);

    // Dispatchable pickups with no live offer that nobody has touched since the cutoff
    List<PickupRequest> findTop100ByStatusInAndAssignmentExpiresAtIsNullAndUpdatedAtBeforeOrderByUpdatedAtAsc(
            Collection<PickupStatus> statuses, Instant cutoff);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE PickupRequest p SET p.status = :finding, p.assignedVendorRef = :vendorRef, "
            + "p.assignmentExpiresAt = :expiresAt, p.updatedAt = :now, p.version = p.version + 1 "
            + "WHERE p.id = :id AND p.version = :version AND p.status IN :dispatchable")
    int holdOffer(@Param("id") UUID id,
                  @Param("version") Long version,
                  @Param("vendorRef") String vendorRef,
                  @Param("expiresAt") Instant expiresAt,
                  @Param("now") Instant now,
                  @Param("finding") PickupStatus finding,
                  @Param("dispatchable") Collection<PickupStatus> dispatchable);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE PickupRequest p SET p.status = :exhausted, p.assignedVendorRef = null, "
            + "p.assignmentExpiresAt = null, p.updatedAt = :now, p.version = p.version + 1 "
            + "WHERE p.id = :id AND p.version = :version AND p.status IN :dispatchable")
    int markExhausted(@Param("id") UUID id,
                      @Param("version") Long version,
                      @Param("now") Instant now,
                      @Param("exhausted") PickupStatus exhausted,
                      @Param("dispatchable") Collection<PickupStatus> dispatchable);

    // The whole acceptance precondition lives in the WHERE clause
    @Modifying(clearAutomatically = true)
    @Query("UPDATE PickupRequest p SET p.status = :assigned, p.assignmentExpiresAt = null, "
            + "p.updatedAt = :now, p.version = p.version + 1 "
            + "WHERE p.id = :id AND p.status = :finding AND p.assignedVendorRef = :vendorRef "
            + "AND p.assignmentExpiresAt > :now")
    int confirmAssignment(@Param("id") UUID id,
                          @Param("vendorRef") String vendorRef,
                          @Param("now") Instant now,
                          @Param("finding") PickupStatus finding,
                          @Param("assigned") PickupStatus assigned);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE PickupRequest p SET p.assignedVendorRef = null, p.assignmentExpiresAt = null, "
            + "p.updatedAt = :now, p.version = p.version + 1 "
            + "WHERE p.id = :id AND p.status = :finding AND p.assignedVendorRef = :vendorRef")
    int releaseOffer(@Param("id") UUID id,
                     @Param("vendorRef") String vendorRef,
                     @Param("now") Instant now,
                     @Param("finding") PickupStatus finding);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE PickupRequest p SET p.assignedVendorRef = null, p.assignmentExpiresAt = null, "
            + "p.updatedAt = :now, p.version = p.version + 1 "
            + "WHERE p.id = :id AND p.status = :finding AND p.assignedVendorRef = :vendorRef "
            + "AND p.assignmentExpiresAt <= :now")
    int releaseExpiredOffer(@Param("id") UUID id,
                            @Param("vendorRef") String vendorRef,
                            @Param("now") Instant now,
                            @Param("finding") PickupStatus finding);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE PickupRequest p SET p.status = :finding, p.assignedVendorRef = null, "
            + "p.assignmentExpiresAt = null, p.dispatchRound = p.dispatchRound + 1, "
            + "p.updatedAt = :now, p.version = p.version + 1 "
            + "WHERE p.id = :id AND p.status IN :retryable")
    int resetForRetry(@Param("id") UUID id,
                      @Param("now") Instant now,
                      @Param("finding") PickupStatus finding,
                      @Param("retryable") Collection<PickupStatus> retryable);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE PickupRequest p SET p.status = :cancelled, p.cancelledAt = :now, "
            + "p.assignedVendorRef = null, p.assignmentExpiresAt = null, "
            + "p.updatedAt = :now, p.version = p.version + 1 "
            + "WHERE p.id = :id AND p.status IN :cancellable")
    int cancel(@Param("id") UUID id,
               @Param("now") Instant now,
               @Param("cancelled") PickupStatus cancelled,
               @Param("cancellable") Collection<PickupStatus> cancellable);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE PickupRequest p SET p.status = :target, p.updatedAt = :now, p.version = p.version + 1 "
            + "WHERE p.id = :id AND p.status = :expected AND p.assignedVendorRef = :vendorRef")
    int advanceStatus(@Param("id") UUID id,
                      @Param("vendorRef") String vendorRef,
                      @Param("expected") PickupStatus expected,
                      @Param("target") PickupStatus target,
                      @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE PickupRequest p SET p.status = :completed, p.completedAt = :now, "
            + "p.updatedAt = :now, p.version = p.version + 1 "
            + "WHERE p.id = :id AND p.status = :expected AND p.assignedVendorRef = :vendorRef")
    int markCompleted(@Param("id") UUID id,
                      @Param("vendorRef") String vendorRef,
                      @Param("expected") PickupStatus expected,
                      @Param("completed") PickupStatus completed,
                      @Param("now") Instant now);
}
