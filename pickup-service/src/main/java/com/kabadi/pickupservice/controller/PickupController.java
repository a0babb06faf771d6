package com.kabadi.pickupservice.controller;

import com.kabadi.pickupservice.dto.CreatePickupRequest;
import com.kabadi.pickupservice.dto.PickupResponse;
import com.kabadi.pickupservice.service.PickupService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/pickups")
@RequiredArgsConstructor
public class PickupController {

    private final PickupService pickupService;

    @PostMapping
    public ResponseEntity<PickupResponse> createPickup(@Valid @RequestBody CreatePickupRequest request) {
        PickupResponse response = pickupService.createPickup(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<PickupResponse>> getCustomerPickups(@RequestParam UUID customerId) {
        return ResponseEntity.ok(pickupService.getCustomerPickups(customerId));
    }

    @GetMapping("/{pickupId}")
    public ResponseEntity<PickupResponse> getPickup(@PathVariable UUID pickupId) {
        return ResponseEntity.ok(pickupService.getPickup(pickupId));
    }

    @PostMapping("/{pickupId}/find-vendor")
    public ResponseEntity<PickupResponse> retryDispatch(@PathVariable UUID pickupId) {
        return ResponseEntity.ok(pickupService.retryDispatch(pickupId));
    }

    @PostMapping("/{pickupId}/cancel")
    public ResponseEntity<PickupResponse> cancelPickup(@PathVariable UUID pickupId) {
        return ResponseEntity.ok(pickupService.cancelPickup(pickupId));
    }
}
