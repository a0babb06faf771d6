package com.kabadi.pickupservice.event;

import com.kabadi.pickupservice.dispatch.DispatchLauncher;
import com.kabadi.pickupservice.dispatch.OfferCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@RequiredArgsConstructor
@Slf4j
public class DispatchEventListener {

    private final OfferCoordinator offerCoordinator;
    private final DispatchLauncher dispatchLauncher;

    // Runs after commit and returns immediately; the HTTP response never waits on a vendor
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleDispatchRequestedEvent(DispatchRequestedEvent event) {
        log.debug("Launching dispatch: pickupId={}, trigger={}", event.getPickupId(), event.getTrigger());
        dispatchLauncher.launch(event.getPickupId(), event.getTrigger(),
                () -> offerCoordinator.dispatch(event.getPickupId()));
    }
}
