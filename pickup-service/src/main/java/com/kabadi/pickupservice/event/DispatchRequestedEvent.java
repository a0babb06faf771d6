package com.kabadi.pickupservice.event;

import com.kabadi.pickupservice.dispatch.DispatchTrigger;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Event published when a pickup needs a vendor search. Dispatch only starts after
 * the publishing transaction commits, so the background task always sees the
 * pickup and its items.
 */
@Getter
public class DispatchRequestedEvent extends ApplicationEvent {
    private final UUID pickupId;
    private final DispatchTrigger trigger;

    public DispatchRequestedEvent(Object source, UUID pickupId, DispatchTrigger trigger) {
        super(source);
        this.pickupId = pickupId;
        this.trigger = trigger;
    }
}
