package com.kabadi.pickupservice.dispatch;

import com.kabadi.pickupservice.dto.VendorOfferPayload;

public interface VendorNotifier {

    /**
     * Sends an offer to the vendor's callback address and waits at most the configured
     * send timeout. Never throws: every transport problem is folded into the result.
     */
    OfferDeliveryResult sendOffer(VendorCandidate candidate, VendorOfferPayload payload);
}
