package com.kabadi.pickupservice.mapper;

import com.kabadi.pickupservice.dto.PickupResponse;
import com.kabadi.pickupservice.dto.VendorOfferPayload;
import com.kabadi.pickupservice.model.PickupItem;
import com.kabadi.pickupservice.model.PickupRequest;
import com.kabadi.pickupservice.model.PickupStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PickupMapper Unit Tests")
class PickupMapperTest {

  private PickupMapper mapper;
  private PickupRequest pickup;
  private UUID scrapTypeId;

  @BeforeEach
  void setUp() {
    mapper = Mappers.getMapper(PickupMapper.class);
    scrapTypeId = UUID.randomUUID();

    pickup = new PickupRequest();
    pickup.setId(UUID.randomUUID());
    pickup.setCustomerId(UUID.randomUUID());
    pickup.setStatus(PickupStatus.FINDING_VENDOR);
    pickup.setAddress("12 MG Road");
    pickup.setLatitude(12.9716);
    pickup.setLongitude(77.5946);
    pickup.setTimeSlot("10:00-12:00");
    pickup.setAssignedVendorRef("V1");
    pickup.setAssignmentExpiresAt(Instant.parse("2026-01-01T10:00:10Z"));

    PickupItem item = new PickupItem();
    item.setScrapTypeId(scrapTypeId);
    item.setEstimatedQuantity(new BigDecimal("3.250"));
    pickup.addItem(item);
  }

  @Test
  @DisplayName("should map the pickup projection including items")
  void shouldMapProjection() {
    // Act
    PickupResponse response = mapper.toPickupResponse(pickup);

    // Assert
    assertThat(response.getId()).isEqualTo(pickup.getId());
    assertThat(response.getStatus()).isEqualTo(PickupStatus.FINDING_VENDOR);
    assertThat(response.getAssignedVendorRef()).isEqualTo("V1");
    assertThat(response.getAssignmentExpiresAt()).isEqualTo(pickup.getAssignmentExpiresAt());
    assertThat(response.getItems()).singleElement().satisfies(item -> {
      assertThat(item.getScrapTypeId()).isEqualTo(scrapTypeId);
      assertThat(item.getEstimatedQuantity()).isEqualByComparingTo("3.25");
    });
  }

  @Test
  @DisplayName("should build the vendor offer for the given vendor and expiry")
  void shouldMapOfferPayload() {
    // Arrange
    Instant expiresAt = Instant.parse("2026-01-01T10:00:10Z");

    // Act
    VendorOfferPayload payload = mapper.toOfferPayload(pickup, "V1", expiresAt);

    // Assert
    assertThat(payload.getPickupId()).isEqualTo(pickup.getId());
    assertThat(payload.getVendorRef()).isEqualTo("V1");
    assertThat(payload.getAddress()).isEqualTo("12 MG Road");
    assertThat(payload.getLatitude()).isEqualTo(12.9716);
    assertThat(payload.getTimeSlot()).isEqualTo("10:00-12:00");
    assertThat(payload.getOfferExpiresAt()).isEqualTo(expiresAt);
    assertThat(payload.getItems()).singleElement()
        .satisfies(item -> assertThat(item.getScrapTypeId()).isEqualTo(scrapTypeId));
  }
}
