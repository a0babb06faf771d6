package com.kabadi.pickupservice.model;

public enum PickupStatus {
    REQUESTED,           // Created, dispatch not started yet
    FINDING_VENDOR,      // Offers are being extended, at most one outstanding
    ASSIGNED,            // A vendor accepted the offer
    ON_THE_WAY,
    COMPLETED,
    NO_VENDOR_AVAILABLE, // Every candidate rejected or timed out
    CANCELLED;

    /**
     * Once a pickup leaves REQUESTED/FINDING_VENDOR no further offers are issued for it.
     */
    public boolean isTerminalForDispatch() {
        return this != REQUESTED && this != FINDING_VENDOR;
    }
}
