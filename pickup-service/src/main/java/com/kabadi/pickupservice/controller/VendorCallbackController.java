package com.kabadi.pickupservice.controller;

import com.kabadi.pickupservice.dispatch.AcceptanceArbiter;
import com.kabadi.pickupservice.dto.PickupResponse;
import com.kabadi.pickupservice.dto.RejectionOutcomeResponse;
import com.kabadi.pickupservice.dto.VendorCallbackRequest;
import com.kabadi.pickupservice.dto.VendorLocationRequest;
import com.kabadi.pickupservice.dto.VendorLocationResponse;
import com.kabadi.pickupservice.service.PickupService;
import com.kabadi.pickupservice.service.VendorService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints called by vendor backends. Bodies accept the legacy field spellings,
 * see {@link VendorCallbackRequest}.
 */
@RestController
@RequestMapping("/api/v1/vendor")
@RequiredArgsConstructor
public class VendorCallbackController {

    private final AcceptanceArbiter acceptanceArbiter;
    private final PickupService pickupService;
    private final VendorService vendorService;

    @PostMapping("/accept")
    public ResponseEntity<PickupResponse> accept(@Valid @RequestBody VendorCallbackRequest request) {
        return ResponseEntity.ok(acceptanceArbiter.confirmVendorAcceptance(request.getPickupId(), request.getVendorRef()));
    }

    @PostMapping("/reject")
    public ResponseEntity<RejectionOutcomeResponse> reject(@Valid @RequestBody VendorCallbackRequest request) {
        return ResponseEntity.ok(acceptanceArbiter.handleVendorRejection(request.getPickupId(), request.getVendorRef()));
    }

    @PostMapping("/on-the-way")
    public ResponseEntity<PickupResponse> onTheWay(@Valid @RequestBody VendorCallbackRequest request) {
        return ResponseEntity.ok(pickupService.markOnTheWay(request.getPickupId(), request.getVendorRef()));
    }

    @PostMapping("/complete")
    public ResponseEntity<PickupResponse> complete(@Valid @RequestBody VendorCallbackRequest request) {
        return ResponseEntity.ok(pickupService.markCompleted(request.getPickupId(), request.getVendorRef()));
    }

    @PostMapping("/location")
    public ResponseEntity<VendorLocationResponse> updateLocation(@Valid @RequestBody VendorLocationRequest request) {
        return ResponseEntity.ok(vendorService.updateLocation(request));
    }
}
