package com.kabadi.pickupservice.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("VendorCandidate Unit Tests")
class VendorCandidateTest {

    @Test
    @DisplayName("should measure great-circle distance in kilometers")
    void shouldMeasureDistance() {
        // 0.009 degrees of latitude is roughly one kilometer
        VendorCandidate candidate = VendorCandidate.builder()
                .vendorRef("V1")
                .latitude(12.9716 + 0.009)
                .longitude(77.5946)
                .build();

        assertThat(candidate.distanceKmTo(12.9716, 77.5946)).isCloseTo(1.0, within(0.01));
    }

    @Test
    @DisplayName("should treat a missing location on either side as infinitely far")
    void shouldTreatMissingLocationAsFar() {
        VendorCandidate located = VendorCandidate.builder().vendorRef("V1").latitude(12.9).longitude(77.5).build();
        VendorCandidate unlocated = VendorCandidate.builder().vendorRef("V2").build();

        assertThat(located.distanceKmTo(null, null)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(unlocated.distanceKmTo(12.9, 77.5)).isEqualTo(Double.POSITIVE_INFINITY);
    }
}
