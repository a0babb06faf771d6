package com.kabadi.pickupservice.dispatch;

import com.kabadi.pickupservice.model.VendorBackend;
import com.kabadi.pickupservice.repository.VendorBackendRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaVendorDirectory implements VendorDirectory {

    private final VendorBackendRepository vendorBackendRepository;

    @Override
    @Transactional(readOnly = true)
    public List<VendorCandidate> findAvailableCandidates() {
        List<VendorBackend> vendors = vendorBackendRepository.findByIsAvailableTrue();
        List<VendorCandidate> candidates = vendors.stream()
                // Nowhere to send the offer
                .filter(vendor -> vendor.getOfferUrl() != null && !vendor.getOfferUrl().isBlank())
                .map(this::toCandidate)
                .toList();
        if (candidates.size() < vendors.size()) {
            log.debug("Skipped {} available vendors without an offer URL", vendors.size() - candidates.size());
        }
        return candidates;
    }

    private VendorCandidate toCandidate(VendorBackend vendor) {
        return VendorCandidate.builder()
                .vendorRef(vendor.getVendorRef())
                .latitude(vendor.getLatitude())
                .longitude(vendor.getLongitude())
                .callbackUrl(vendor.getOfferUrl())
                .available(Boolean.TRUE.equals(vendor.getIsAvailable()))
                .lastSeenAt(vendor.getLastSeenAt())
                .build();
    }
}
