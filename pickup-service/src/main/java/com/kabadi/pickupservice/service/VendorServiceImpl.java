package com.kabadi.pickupservice.service;

import com.kabadi.pickupservice.dto.VendorLocationRequest;
import com.kabadi.pickupservice.dto.VendorLocationResponse;
import com.kabadi.pickupservice.model.VendorBackend;
import com.kabadi.pickupservice.repository.VendorBackendRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class VendorServiceImpl implements VendorService {

    private final VendorBackendRepository vendorBackendRepository;
    private final Clock clock;

    @Override
    @Transactional
    public VendorLocationResponse updateLocation(VendorLocationRequest request) {
        VendorBackend vendor = vendorBackendRepository.findById(request.getVendorRef())
                .orElseGet(() -> {
                    log.info("Registering new vendor backend: vendorRef={}", request.getVendorRef());
                    return VendorBackend.builder().vendorRef(request.getVendorRef()).build();
                });

        vendor.setLatitude(request.getLatitude());
        vendor.setLongitude(request.getLongitude());
        if (request.getOfferUrl() != null && !request.getOfferUrl().isBlank()) {
            vendor.setOfferUrl(request.getOfferUrl());
        }
        vendor.setIsAvailable(true);
        vendor.setLastSeenAt(Instant.now(clock));

        VendorBackend saved = vendorBackendRepository.save(vendor);
        log.debug("Vendor location updated: vendorRef={}, lat={}, lon={}",
                saved.getVendorRef(), saved.getLatitude(), saved.getLongitude());

        return VendorLocationResponse.builder()
                .vendorRef(saved.getVendorRef())
                .isAvailable(saved.getIsAvailable())
                .lastSeenAt(saved.getLastSeenAt())
                .build();
    }
}
