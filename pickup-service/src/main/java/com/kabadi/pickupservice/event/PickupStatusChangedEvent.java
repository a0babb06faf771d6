package com.kabadi.pickupservice.event;

import com.kabadi.pickupservice.model.PickupRequest;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Event published inside the transaction that moved a pickup to a status other
 * services care about. Handled synchronously so the outbox row commits or rolls
 * back together with the status change.
 */
@Getter
public class PickupStatusChangedEvent extends ApplicationEvent {
    private final PickupRequest pickup;

    public PickupStatusChangedEvent(Object source, PickupRequest pickup) {
        super(source);
        this.pickup = pickup;
    }
}
