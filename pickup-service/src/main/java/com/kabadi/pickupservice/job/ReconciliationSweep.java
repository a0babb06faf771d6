package com.kabadi.pickupservice.job;

import com.kabadi.pickupservice.config.DispatchProperties;
import com.kabadi.pickupservice.dispatch.DispatchLauncher;
import com.kabadi.pickupservice.dispatch.DispatchTrigger;
import com.kabadi.pickupservice.dispatch.OfferCoordinator;
import com.kabadi.pickupservice.dispatch.PickupTransitions;
import com.kabadi.pickupservice.model.PickupRequest;
import com.kabadi.pickupservice.model.PickupStatus;
import com.kabadi.pickupservice.repository.PickupRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Backstop for in-memory dispatch work. Two passes, both ending in the same
 * conditional writes the live path uses:
 * <ul>
 *   <li>offers that expired without being handled (timer lost on restart, fired
 *   early, or owned by another instance) go through the expiry path;</li>
 *   <li>pickups left dispatchable with no offer at all (dispatch dropped by a full
 *   executor, or failed between releasing one offer and holding the next) are
 *   dispatched again once they have been idle for an offer window.</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationSweep {

    private final PickupRequestRepository pickupRequestRepository;
    private final OfferCoordinator offerCoordinator;
    private final DispatchLauncher dispatchLauncher;
    private final DispatchProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${dispatch.sweep-interval-ms:10000}")
    public void reconcileExpiredOffers() {
        List<PickupRequest> expired = pickupRequestRepository
                .findTop100ByStatusAndAssignmentExpiresAtBeforeOrderByAssignmentExpiresAtAsc(
                        PickupStatus.FINDING_VENDOR, Instant.now(clock));

        if (expired.isEmpty()) {
            return;
        }

        log.info("Sweep found {} expired offers", expired.size());

        for (PickupRequest pickup : expired) {
            String vendorRef = pickup.getAssignedVendorRef();
            if (vendorRef == null) {
                continue;
            }
            dispatchLauncher.launch(pickup.getId(), DispatchTrigger.SWEEP,
                    () -> offerCoordinator.expireOffer(pickup.getId(), vendorRef));
        }
    }

    @Scheduled(fixedDelayString = "${dispatch.sweep-interval-ms:10000}")
    public void resumeStalledDispatches() {
        Instant cutoff = Instant.now(clock).minus(properties.getOfferWindow());
        List<PickupRequest> stalled = pickupRequestRepository
                .findTop100ByStatusInAndAssignmentExpiresAtIsNullAndUpdatedAtBeforeOrderByUpdatedAtAsc(
                        PickupTransitions.DISPATCHABLE, cutoff);

        if (stalled.isEmpty()) {
            return;
        }

        log.warn("Sweep found {} pickups without a live offer, redispatching", stalled.size());

        for (PickupRequest pickup : stalled) {
            log.info("Resuming dispatch: pickupId={}, status={}, idleSince={}",
                    pickup.getId(), pickup.getStatus(), pickup.getUpdatedAt());
            dispatchLauncher.launch(pickup.getId(), DispatchTrigger.SWEEP,
                    () -> offerCoordinator.dispatch(pickup.getId()));
        }
    }
}
