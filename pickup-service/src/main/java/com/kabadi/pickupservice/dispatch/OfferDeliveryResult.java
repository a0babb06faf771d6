package com.kabadi.pickupservice.dispatch;

public enum OfferDeliveryResult {
    // 2xx received; the vendor answers later through the callback boundary
    DELIVERED,
    // Non-2xx, connection refused, bad URL
    FAILED,
    TIMED_OUT;

    public boolean isDelivered() {
        return this == DELIVERED;
    }
}
