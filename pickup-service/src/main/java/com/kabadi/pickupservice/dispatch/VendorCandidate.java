package com.kabadi.pickupservice.dispatch;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of a vendor eligible for offers, read fresh on every dispatch attempt.
 */
@Value
@Builder
public class VendorCandidate {
    String vendorRef;
    Double latitude;
    Double longitude;
    String callbackUrl;
    boolean available;
    Instant lastSeenAt;

    /**
     * Distance to the given point, or {@link Double#POSITIVE_INFINITY} when either side
     * has no location, so such vendors rank after every located one.
     */
    public double distanceKmTo(Double lat, Double lon) {
        if (latitude == null || longitude == null || lat == null || lon == null) {
            return Double.POSITIVE_INFINITY;
        }
        return GeoDistance.haversineKm(lat, lon, latitude, longitude);
    }
}
