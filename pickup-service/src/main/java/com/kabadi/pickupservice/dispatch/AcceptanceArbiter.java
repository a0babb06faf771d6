package com.kabadi.pickupservice.dispatch;

import com.kabadi.common.exception.ResourceNotFoundException;
import com.kabadi.pickupservice.dto.PickupResponse;
import com.kabadi.pickupservice.dto.RejectionOutcomeResponse;
import com.kabadi.pickupservice.exception.AssignmentConflictException;
import com.kabadi.pickupservice.mapper.PickupMapper;
import com.kabadi.pickupservice.model.PickupRequest;
import com.kabadi.pickupservice.model.PickupStatus;
import com.kabadi.pickupservice.model.RejectionReason;
import com.kabadi.pickupservice.repository.PickupRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides vendor answers to offers. Acceptance is a single conditional write, so of
 * any number of concurrent accepts for one pickup exactly one succeeds.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AcceptanceArbiter {

    private final PickupRequestRepository pickupRequestRepository;
    private final PickupTransitions transitions;
    private final OfferCoordinator offerCoordinator;
    private final PickupMapper pickupMapper;
    private final Clock clock;

    /**
     * @throws ResourceNotFoundException  if the pickup does not exist
     * @throws AssignmentConflictException if the vendor does not hold a live offer
     */
    public PickupResponse confirmVendorAcceptance(UUID pickupId, String vendorRef) {
        Optional<PickupRequest> assigned = transitions.confirmAssignment(pickupId, vendorRef);
        if (assigned.isEmpty()) {
            PickupRequest current = findPickup(pickupId);
            String reason = describeConflict(current, vendorRef);
            log.warn("Acceptance refused: pickupId={}, vendorRef={}, reason={}", pickupId, vendorRef, reason);
            throw new AssignmentConflictException(reason);
        }
        offerCoordinator.complete(pickupId);
        return pickupMapper.toPickupResponse(assigned.get());
    }

    /**
     * A rejection from a vendor that does not hold the current offer is reported as
     * ignored. Otherwise the vendor is excluded and the next candidate is offered
     * before this returns.
     */
    public RejectionOutcomeResponse handleVendorRejection(UUID pickupId, String vendorRef) {
        findPickup(pickupId);

        if (!transitions.releaseOffer(pickupId, vendorRef, RejectionReason.EXPLICIT_REJECT)) {
            log.warn("Rejection ignored, vendor holds no offer: pickupId={}, vendorRef={}", pickupId, vendorRef);
            return RejectionOutcomeResponse.ignored(pickupId, vendorRef);
        }

        offerCoordinator.invalidate(pickupId);
        offerCoordinator.dispatch(pickupId);

        PickupRequest after = findPickup(pickupId);
        return RejectionOutcomeResponse.builder()
                .pickupId(pickupId)
                .vendorRef(vendorRef)
                .ignored(false)
                .pickup(pickupMapper.toPickupResponse(after))
                .build();
    }

    private PickupRequest findPickup(UUID pickupId) {
        return pickupRequestRepository.findWithItemsById(pickupId)
                .orElseThrow(() -> new ResourceNotFoundException("Pickup not found with id: " + pickupId));
    }

    private String describeConflict(PickupRequest pickup, String vendorRef) {
        if (pickup.getStatus() != PickupStatus.FINDING_VENDOR) {
            return "Pickup " + pickup.getId() + " is " + pickup.getStatus() + " and no longer accepts offers";
        }
        if (!vendorRef.equals(pickup.getAssignedVendorRef())) {
            return "Pickup " + pickup.getId() + " is not currently offered to vendor " + vendorRef;
        }
        Instant expiresAt = pickup.getAssignmentExpiresAt();
        if (expiresAt != null && !Instant.now(clock).isBefore(expiresAt)) {
            return "Offer for pickup " + pickup.getId() + " expired at " + expiresAt;
        }
        return "Pickup " + pickup.getId() + " changed concurrently";
    }
}
