package com.kabadi.pickupservice.dispatch;

import com.kabadi.pickupservice.model.VendorBackend;
import com.kabadi.pickupservice.repository.VendorBackendRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JpaVendorDirectory Unit Tests")
class JpaVendorDirectoryTest {

    @Mock
    private VendorBackendRepository vendorBackendRepository;

    @InjectMocks
    private JpaVendorDirectory directory;

    @Test
    @DisplayName("should map available vendors to candidates")
    void shouldMapAvailableVendors() {
        // Arrange
        Instant seen = Instant.parse("2026-01-01T09:59:00Z");
        when(vendorBackendRepository.findByIsAvailableTrue()).thenReturn(List.of(
                VendorBackend.builder()
                        .vendorRef("V1")
                        .latitude(12.98)
                        .longitude(77.60)
                        .offerUrl("http://v1.vendors.test/offers")
                        .lastSeenAt(seen)
                        .build()));

        // Act
        List<VendorCandidate> candidates = directory.findAvailableCandidates();

        // Assert
        assertThat(candidates).singleElement().satisfies(candidate -> {
            assertThat(candidate.getVendorRef()).isEqualTo("V1");
            assertThat(candidate.getCallbackUrl()).isEqualTo("http://v1.vendors.test/offers");
            assertThat(candidate.isAvailable()).isTrue();
            assertThat(candidate.getLastSeenAt()).isEqualTo(seen);
        });
    }

    @Test
    @DisplayName("should leave out vendors that have no offer URL")
    void shouldSkipVendorsWithoutOfferUrl() {
        // Arrange
        when(vendorBackendRepository.findByIsAvailableTrue()).thenReturn(List.of(
                VendorBackend.builder().vendorRef("V-no-url").build(),
                VendorBackend.builder().vendorRef("V-blank").offerUrl("  ").build(),
                VendorBackend.builder().vendorRef("V-ok").offerUrl("http://ok.vendors.test/offers").build()));

        // Act
        List<VendorCandidate> candidates = directory.findAvailableCandidates();

        // Assert
        assertThat(candidates).extracting(VendorCandidate::getVendorRef).containsExactly("V-ok");
    }
}
