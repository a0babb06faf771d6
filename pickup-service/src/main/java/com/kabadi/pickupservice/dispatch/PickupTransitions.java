package com.kabadi.pickupservice.dispatch;

import com.kabadi.pickupservice.event.PickupStatusChangedEvent;
import com.kabadi.pickupservice.model.PickupRequest;
import com.kabadi.pickupservice.model.PickupStatus;
import com.kabadi.pickupservice.model.RejectionReason;
import com.kabadi.pickupservice.repository.PickupRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.kabadi.pickupservice.model.PickupStatus.ASSIGNED;
import static com.kabadi.pickupservice.model.PickupStatus.CANCELLED;
import static com.kabadi.pickupservice.model.PickupStatus.COMPLETED;
import static com.kabadi.pickupservice.model.PickupStatus.FINDING_VENDOR;
import static com.kabadi.pickupservice.model.PickupStatus.NO_VENDOR_AVAILABLE;
import static com.kabadi.pickupservice.model.PickupStatus.ON_THE_WAY;
import static com.kabadi.pickupservice.model.PickupStatus.REQUESTED;

/**
 * The only writer of pickup status. Each method is one conditional UPDATE plus the
 * side effects of winning it (ledger entry, outbox event), all in one transaction.
 * A method that reports failure wrote nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PickupTransitions {

    public static final Set<PickupStatus> DISPATCHABLE = EnumSet.of(REQUESTED, FINDING_VENDOR);
    public static final Set<PickupStatus> RETRYABLE = EnumSet.of(REQUESTED, FINDING_VENDOR, NO_VENDOR_AVAILABLE);
    public static final Set<PickupStatus> CANCELLABLE = EnumSet.of(REQUESTED, FINDING_VENDOR);

    private final PickupRequestRepository pickupRequestRepository;
    private final RejectionLedger rejectionLedger;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Offers the pickup to {@code vendorRef} until {@code expiresAt}. Fails if the pickup
     * changed since {@code pickup} was read.
     */
    @Transactional
    public boolean holdOffer(PickupRequest pickup, String vendorRef, Instant expiresAt) {
        int updated = pickupRequestRepository.holdOffer(pickup.getId(), pickup.getVersion(), vendorRef,
                expiresAt, now(), FINDING_VENDOR, DISPATCHABLE);
        if (updated == 0) {
            log.info("Offer hold lost, pickup changed concurrently: pickupId={}, vendorRef={}",
                    pickup.getId(), vendorRef);
            return false;
        }
        log.info("Offer held: pickupId={}, vendorRef={}, expiresAt={}", pickup.getId(), vendorRef, expiresAt);
        return true;
    }

    @Transactional
    public boolean markNoVendorAvailable(PickupRequest pickup) {
        int updated = pickupRequestRepository.markExhausted(pickup.getId(), pickup.getVersion(), now(),
                NO_VENDOR_AVAILABLE, DISPATCHABLE);
        if (updated == 0) {
            return false;
        }
        log.info("No vendor available: pickupId={}, round={}", pickup.getId(), pickup.getDispatchRound());
        publishStatusChange(pickup.getId());
        return true;
    }

    @Transactional
    public Optional<PickupRequest> confirmAssignment(UUID pickupId, String vendorRef) {
        int updated = pickupRequestRepository.confirmAssignment(pickupId, vendorRef, now(), FINDING_VENDOR, ASSIGNED);
        if (updated == 0) {
            return Optional.empty();
        }
        log.info("Pickup assigned: pickupId={}, vendorRef={}", pickupId, vendorRef);
        return Optional.of(publishStatusChange(pickupId));
    }

    /**
     * Clears the offer held by {@code vendorRef} and records why it was given up.
     * Pickup stays FINDING_VENDOR; the caller redispatches.
     */
    @Transactional
    public boolean releaseOffer(UUID pickupId, String vendorRef, RejectionReason reason) {
        int updated = pickupRequestRepository.releaseOffer(pickupId, vendorRef, now(), FINDING_VENDOR);
        if (updated == 0) {
            return false;
        }
        recordRejection(pickupId, vendorRef, reason);
        return true;
    }

    // Same as releaseOffer(TIMEOUT) but only once the offer has actually expired
    @Transactional
    public boolean releaseExpiredOffer(UUID pickupId, String vendorRef) {
        int updated = pickupRequestRepository.releaseExpiredOffer(pickupId, vendorRef, now(), FINDING_VENDOR);
        if (updated == 0) {
            return false;
        }
        recordRejection(pickupId, vendorRef, RejectionReason.TIMEOUT);
        return true;
    }

    // Starts a new dispatch round: offer cleared, previous round's exclusions no longer apply
    @Transactional
    public boolean resetForRetry(UUID pickupId) {
        int updated = pickupRequestRepository.resetForRetry(pickupId, now(), FINDING_VENDOR, RETRYABLE);
        if (updated == 0) {
            return false;
        }
        log.info("Dispatch reset by customer: pickupId={}", pickupId);
        return true;
    }

    @Transactional
    public Optional<PickupRequest> cancel(UUID pickupId) {
        int updated = pickupRequestRepository.cancel(pickupId, now(), CANCELLED, CANCELLABLE);
        if (updated == 0) {
            return Optional.empty();
        }
        log.info("Pickup cancelled: pickupId={}", pickupId);
        return Optional.of(publishStatusChange(pickupId));
    }

    @Transactional
    public Optional<PickupRequest> markOnTheWay(UUID pickupId, String vendorRef) {
        int updated = pickupRequestRepository.advanceStatus(pickupId, vendorRef, ASSIGNED, ON_THE_WAY, now());
        if (updated == 0) {
            return Optional.empty();
        }
        log.info("Vendor on the way: pickupId={}, vendorRef={}", pickupId, vendorRef);
        return Optional.of(publishStatusChange(pickupId));
    }

    @Transactional
    public Optional<PickupRequest> markCompleted(UUID pickupId, String vendorRef) {
        int updated = pickupRequestRepository.markCompleted(pickupId, vendorRef, ON_THE_WAY, COMPLETED, now());
        if (updated == 0) {
            return Optional.empty();
        }
        log.info("Pickup completed: pickupId={}, vendorRef={}", pickupId, vendorRef);
        return Optional.of(publishStatusChange(pickupId));
    }

    private void recordRejection(UUID pickupId, String vendorRef, RejectionReason reason) {
        PickupRequest pickup = reload(pickupId);
        rejectionLedger.record(pickupId, vendorRef, reason, pickup.getDispatchRound());
    }

    private PickupRequest publishStatusChange(UUID pickupId) {
        PickupRequest pickup = reload(pickupId);
        eventPublisher.publishEvent(new PickupStatusChangedEvent(this, pickup));
        return pickup;
    }

    // The conditional UPDATE cleared the persistence context, so this is a fresh read
    private PickupRequest reload(UUID pickupId) {
        return pickupRequestRepository.findWithItemsById(pickupId)
                .orElseThrow(() -> new IllegalStateException("Pickup vanished after update: " + pickupId));
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
