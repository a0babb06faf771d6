package com.kabadi.pickupservice.mapper;

import com.kabadi.pickupservice.dto.PickupItemResponse;
import com.kabadi.pickupservice.dto.PickupResponse;
import com.kabadi.pickupservice.dto.VendorOfferItem;
import com.kabadi.pickupservice.dto.VendorOfferPayload;
import com.kabadi.pickupservice.model.PickupItem;
import com.kabadi.pickupservice.model.PickupRequest;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.time.Instant;
import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface PickupMapper {

    // items must already be fetched (see PickupRequestRepository.findWithItemsById)
    PickupResponse toPickupResponse(PickupRequest pickup);

    List<PickupResponse> toPickupResponses(List<PickupRequest> pickups);

    PickupItemResponse toPickupItemResponse(PickupItem item);

    @Mapping(target = "pickupId", source = "pickup.id")
    @Mapping(target = "vendorRef", source = "vendorRef")
    @Mapping(target = "address", source = "pickup.address")
    @Mapping(target = "latitude", source = "pickup.latitude")
    @Mapping(target = "longitude", source = "pickup.longitude")
    @Mapping(target = "timeSlot", source = "pickup.timeSlot")
    @Mapping(target = "items", source = "pickup.items")
    @Mapping(target = "offerExpiresAt", source = "offerExpiresAt")
    VendorOfferPayload toOfferPayload(PickupRequest pickup, String vendorRef, Instant offerExpiresAt);

    VendorOfferItem toOfferItem(PickupItem item);
}
