package com.kabadi.pickupservice.dispatch;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.concurrent.ScheduledFuture;

/**
 * Process-local liveness state of one pickup's dispatch. Not authoritative: losing it
 * (restart, second instance) only delays expiry until the reconciliation sweep runs.
 */
@Getter
@ToString
@AllArgsConstructor
public final class DispatchState {

    private final long generation;

    // null until an offer timer is armed for this generation
    private final String vendorRef;

    @ToString.Exclude
    private final ScheduledFuture<?> timer;

    static DispatchState pending(long generation) {
        return new DispatchState(generation, null, null);
    }

    void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
        }
    }
}
