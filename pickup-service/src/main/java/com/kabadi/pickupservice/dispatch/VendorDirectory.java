package com.kabadi.pickupservice.dispatch;

import java.util.List;

public interface VendorDirectory {

    /**
     * Vendors currently able to receive an offer, in no particular order.
     */
    List<VendorCandidate> findAvailableCandidates();
}
