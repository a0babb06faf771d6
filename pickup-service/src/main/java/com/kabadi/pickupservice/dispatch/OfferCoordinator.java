package com.kabadi.pickupservice.dispatch;

import com.kabadi.common.exception.ResourceNotFoundException;
import com.kabadi.pickupservice.config.DispatchProperties;
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
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Offers a pickup to one vendor at a time, nearest first, until one accepts or the
 * candidates run out.
 * <p>
 * Correctness rests on the conditional writes in {@link PickupTransitions}; the timers
 * kept in {@link DispatchStateTable} only make expiry prompt. A timer that fires for a
 * superseded generation is ignored, and one that is lost entirely is covered by the
 * reconciliation sweep.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OfferCoordinator {

    private final PickupRequestRepository pickupRequestRepository;
    private final VendorDirectory vendorDirectory;
    private final RejectionLedger rejectionLedger;
    private final VendorNotifier vendorNotifier;
    private final PickupTransitions transitions;
    private final PickupMapper pickupMapper;
    private final DispatchStateTable stateTable;
    private final DispatchLauncher launcher;
    private final DispatchProperties properties;
    private final Clock clock;

    /**
     * Runs one dispatch attempt for the pickup. Safe to call repeatedly and concurrently:
     * each call starts a new generation, and at most one of several racing calls wins
     * the offer hold.
     */
    public void dispatch(UUID pickupId) {
        long generation = stateTable.begin(pickupId);

        try {
            // Loops only when an offer could not be delivered
            while (true) {
                PickupRequest pickup = pickupRequestRepository.findWithItemsById(pickupId)
                        .orElseThrow(() -> new ResourceNotFoundException("Pickup not found with id: " + pickupId));

                if (pickup.getStatus().isTerminalForDispatch()) {
                    log.debug("Dispatch skipped, pickup is {}: pickupId={}", pickup.getStatus(), pickupId);
                    stateTable.discard(pickupId, generation);
                    return;
                }

                List<VendorCandidate> candidates = rankCandidates(pickup);
                if (candidates.isEmpty()) {
                    transitions.markNoVendorAvailable(pickup);
                    stateTable.discard(pickupId, generation);
                    return;
                }

                VendorCandidate candidate = candidates.get(0);
                String vendorRef = candidate.getVendorRef();
                Instant expiresAt = Instant.now(clock).plus(properties.getOfferWindow());

                if (!transitions.holdOffer(pickup, vendorRef, expiresAt)) {
                    // Whoever changed the pickup owns the next step
                    stateTable.discard(pickupId, generation);
                    return;
                }

                boolean armed = armTimer(pickupId, generation, vendorRef, expiresAt);
                if (!armed || !stateTable.isCurrent(pickupId, generation)) {
                    log.debug("Dispatch superseded before sending: pickupId={}, vendorRef={}", pickupId, vendorRef);
                    return;
                }

                log.info("Offering pickup: pickupId={}, vendorRef={}, remainingCandidates={}",
                        pickupId, vendorRef, candidates.size() - 1);
                OfferDeliveryResult result = vendorNotifier.sendOffer(candidate,
                        pickupMapper.toOfferPayload(pickup, vendorRef, expiresAt));
                if (result.isDelivered()) {
                    return;
                }

                log.warn("Offer not delivered, moving on: pickupId={}, vendorRef={}, result={}",
                        pickupId, vendorRef, result);
                if (!transitions.releaseOffer(pickupId, vendorRef, RejectionReason.SEND_FAILURE)) {
                    // Accepted, rejected or cancelled while the call was in flight
                    stateTable.discard(pickupId, generation);
                    return;
                }
                generation = stateTable.begin(pickupId);
            }
        } catch (RuntimeException e) {
            // Left to the reconciliation sweep, which finds the pickup idle without a live offer
            stateTable.discard(pickupId, generation);
            throw e;
        }
    }

    /**
     * Timer callback. Acts only if no newer dispatch attempt started since the timer
     * was armed. A timer that fires before the stored expiry is armed again for the
     * remaining time; one whose offer was already resolved elsewhere drops its entry.
     */
    public void handleOfferTimeout(UUID pickupId, long generation, String vendorRef) {
        if (!stateTable.isCurrent(pickupId, generation)) {
            log.debug("Stale offer timer ignored: pickupId={}, vendorRef={}, generation={}",
                    pickupId, vendorRef, generation);
            return;
        }
        if (expireOffer(pickupId, vendorRef)) {
            return;
        }

        Optional<Instant> pendingExpiry = pendingExpiry(pickupId, vendorRef);
        if (pendingExpiry.isPresent() && armTimer(pickupId, generation, vendorRef, pendingExpiry.get())) {
            log.debug("Offer timer fired early, re-armed: pickupId={}, vendorRef={}, expiresAt={}",
                    pickupId, vendorRef, pendingExpiry.get());
            return;
        }
        stateTable.discard(pickupId, generation);
    }

    /**
     * Expires {@code vendorRef}'s offer if it is still outstanding and past its expiry,
     * then redispatches. Shared by live timers and the reconciliation sweep; whichever
     * arrives second finds nothing to release.
     *
     * @return false if there was no expired offer to release
     */
    public boolean expireOffer(UUID pickupId, String vendorRef) {
        if (!transitions.releaseExpiredOffer(pickupId, vendorRef)) {
            log.debug("Offer no longer outstanding: pickupId={}, vendorRef={}", pickupId, vendorRef);
            return false;
        }
        log.info("Offer expired: pickupId={}, vendorRef={}", pickupId, vendorRef);
        dispatch(pickupId);
        return true;
    }

    // Drops any armed timer; used before cancel and retry write their own state
    public void invalidate(UUID pickupId) {
        stateTable.discard(pickupId);
    }

    public void complete(UUID pickupId) {
        stateTable.discard(pickupId);
    }

    private boolean armTimer(UUID pickupId, long generation, String vendorRef, Instant fireAt) {
        return stateTable.arm(pickupId, generation, vendorRef, fireAt,
                () -> launcher.launch(pickupId, DispatchTrigger.OFFER_TIMEOUT,
                        () -> handleOfferTimeout(pickupId, generation, vendorRef)));
    }

    // Expiry of vendorRef's offer if it is still held and not yet due
    private Optional<Instant> pendingExpiry(UUID pickupId, String vendorRef) {
        Instant now = Instant.now(clock);
        return pickupRequestRepository.findById(pickupId)
                .filter(current -> current.getStatus() == PickupStatus.FINDING_VENDOR)
                .filter(current -> vendorRef.equals(current.getAssignedVendorRef()))
                .map(PickupRequest::getAssignmentExpiresAt)
                .filter(now::isBefore);
    }

    List<VendorCandidate> rankCandidates(PickupRequest pickup) {
        Set<String> excluded = rejectionLedger.excludedVendors(pickup.getId(), pickup.getDispatchRound());
        return vendorDirectory.findAvailableCandidates().stream()
                .filter(VendorCandidate::isAvailable)
                .filter(candidate -> !excluded.contains(candidate.getVendorRef()))
                .sorted(Comparator
                        .comparingDouble((VendorCandidate candidate) ->
                                candidate.distanceKmTo(pickup.getLatitude(), pickup.getLongitude()))
                        .thenComparing(VendorCandidate::getVendorRef))
                .toList();
    }
}
