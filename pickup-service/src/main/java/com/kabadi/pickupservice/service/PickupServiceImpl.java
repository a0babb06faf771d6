package com.kabadi.pickupservice.service;

import com.kabadi.common.exception.ResourceNotFoundException;
import com.kabadi.pickupservice.dispatch.DispatchTrigger;
import com.kabadi.pickupservice.dispatch.OfferCoordinator;
import com.kabadi.pickupservice.dispatch.PickupTransitions;
import com.kabadi.pickupservice.dto.CreatePickupRequest;
import com.kabadi.pickupservice.dto.PickupItemRequest;
import com.kabadi.pickupservice.dto.PickupResponse;
import com.kabadi.pickupservice.event.DispatchRequestedEvent;
import com.kabadi.pickupservice.event.PickupStatusChangedEvent;
import com.kabadi.pickupservice.exception.AssignmentConflictException;
import com.kabadi.pickupservice.exception.InvalidPickupStateException;
import com.kabadi.pickupservice.mapper.PickupMapper;
import com.kabadi.pickupservice.model.PickupItem;
import com.kabadi.pickupservice.model.PickupRequest;
import com.kabadi.pickupservice.model.PickupStatus;
import com.kabadi.pickupservice.repository.PickupRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class PickupServiceImpl implements PickupService {

    private final PickupRequestRepository pickupRequestRepository;
    private final PickupTransitions transitions;
    private final OfferCoordinator offerCoordinator;
    private final PickupMapper pickupMapper;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public PickupResponse createPickup(CreatePickupRequest request) {
        if ((request.getLatitude() == null) != (request.getLongitude() == null)) {
            throw new IllegalArgumentException("latitude and longitude must be provided together");
        }

        PickupRequest pickup = new PickupRequest();
        pickup.setCustomerId(request.getCustomerId());
        pickup.setStatus(PickupStatus.REQUESTED);
        pickup.setAddress(request.getAddress());
        pickup.setLatitude(request.getLatitude());
        pickup.setLongitude(request.getLongitude());
        pickup.setTimeSlot(request.getTimeSlot());
        pickup.setDispatchRound(1);

        for (PickupItemRequest reqItem : request.getItems()) {
            PickupItem item = new PickupItem();
            item.setScrapTypeId(reqItem.getScrapTypeId());
            item.setEstimatedQuantity(reqItem.getEstimatedQuantity());
            pickup.addItem(item);
        }

        PickupRequest saved = pickupRequestRepository.saveAndFlush(pickup);
        log.info("Pickup created: pickupId={}, items={}, located={}",
                saved.getId(), saved.getItems().size(), saved.hasCoordinates());

        eventPublisher.publishEvent(new PickupStatusChangedEvent(this, saved));
        // Handled after commit, so dispatch never sees a half-written pickup
        eventPublisher.publishEvent(new DispatchRequestedEvent(this, saved.getId(), DispatchTrigger.CREATED));

        return pickupMapper.toPickupResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public PickupResponse getPickup(UUID pickupId) {
        return pickupMapper.toPickupResponse(findPickup(pickupId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<PickupResponse> getCustomerPickups(UUID customerId) {
        return pickupMapper.toPickupResponses(pickupRequestRepository.findByCustomerIdOrderByCreatedAtDesc(customerId));
    }

    @Override
    @Transactional
    public PickupResponse retryDispatch(UUID pickupId) {
        PickupRequest pickup = findPickup(pickupId);
        if (!PickupTransitions.RETRYABLE.contains(pickup.getStatus())) {
            log.warn("Retry refused: pickupId={}, status={}", pickupId, pickup.getStatus());
            throw new InvalidPickupStateException(
                    "Cannot retry vendor assignment for status " + pickup.getStatus());
        }

        // Old timers must be gone before the new round exists
        offerCoordinator.invalidate(pickupId);
        if (!transitions.resetForRetry(pickupId)) {
            throw new AssignmentConflictException("Pickup " + pickupId + " changed concurrently, please refresh");
        }

        eventPublisher.publishEvent(new DispatchRequestedEvent(this, pickupId, DispatchTrigger.CUSTOMER_RETRY));
        return pickupMapper.toPickupResponse(findPickup(pickupId));
    }

    @Override
    @Transactional
    public PickupResponse cancelPickup(UUID pickupId) {
        PickupRequest pickup = findPickup(pickupId);
        if (pickup.getStatus() == PickupStatus.CANCELLED) {
            return pickupMapper.toPickupResponse(pickup);
        }
        if (!PickupTransitions.CANCELLABLE.contains(pickup.getStatus())) {
            log.warn("Cancel refused: pickupId={}, status={}", pickupId, pickup.getStatus());
            throw new InvalidPickupStateException("Cannot cancel pickup in status " + pickup.getStatus());
        }

        offerCoordinator.invalidate(pickupId);
        PickupRequest cancelled = transitions.cancel(pickupId)
                .orElseThrow(() -> new AssignmentConflictException(
                        "Pickup " + pickupId + " changed concurrently, please refresh"));
        return pickupMapper.toPickupResponse(cancelled);
    }

    @Override
    @Transactional
    public PickupResponse markOnTheWay(UUID pickupId, String vendorRef) {
        Optional<PickupRequest> updated = transitions.markOnTheWay(pickupId, vendorRef);
        return pickupMapper.toPickupResponse(
                updated.orElseThrow(() -> refuseVendorAction(pickupId, vendorRef, PickupStatus.ON_THE_WAY)));
    }

    @Override
    @Transactional
    public PickupResponse markCompleted(UUID pickupId, String vendorRef) {
        Optional<PickupRequest> updated = transitions.markCompleted(pickupId, vendorRef);
        return pickupMapper.toPickupResponse(
                updated.orElseThrow(() -> refuseVendorAction(pickupId, vendorRef, PickupStatus.COMPLETED)));
    }

    private RuntimeException refuseVendorAction(UUID pickupId, String vendorRef, PickupStatus target) {
        PickupRequest pickup = findPickup(pickupId);
        log.warn("Vendor status update refused: pickupId={}, vendorRef={}, status={}, target={}",
                pickupId, vendorRef, pickup.getStatus(), target);
        if (pickup.getAssignedVendorRef() != null && !pickup.getAssignedVendorRef().equals(vendorRef)) {
            return new AssignmentConflictException("Pickup " + pickupId + " is assigned to another vendor");
        }
        return new InvalidPickupStateException(
                "Cannot move pickup from " + pickup.getStatus() + " to " + target);
    }

    private PickupRequest findPickup(UUID pickupId) {
        return pickupRequestRepository.findWithItemsById(pickupId)
                .orElseThrow(() -> new ResourceNotFoundException("Pickup not found with id: " + pickupId));
    }
}
