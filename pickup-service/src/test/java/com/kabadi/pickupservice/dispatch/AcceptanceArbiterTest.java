package com.kabadi.pickupservice.dispatch;

import com.kabadi.common.exception.ResourceNotFoundException;
import com.kabadi.pickupservice.dto.PickupResponse;
import com.kabadi.pickupservice.dto.RejectionOutcomeResponse;
import com.kabadi.pickupservice.exception.AssignmentConflictException;
import com.kabadi.pickupservice.mapper.PickupMapper;
import com.kabadi.pickupservice.model.PickupRequest;
import com.kabadi.pickupservice.model.PickupStatus;
import com.kabadi.pickupservice.model.RejectionReason;
import com.kabadi.pickupservice.repository.PickupRequestRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AcceptanceArbiter Unit Tests")
class AcceptanceArbiterTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock
    private PickupRequestRepository pickupRequestRepository;

    @Mock
    private PickupTransitions transitions;

    @Mock
    private OfferCoordinator offerCoordinator;

    @Mock
    private PickupMapper pickupMapper;

    private AcceptanceArbiter arbiter;

    private UUID pickupId;
    private PickupRequest pickup;

    @BeforeEach
    void setUp() {
        arbiter = new AcceptanceArbiter(pickupRequestRepository, transitions, offerCoordinator, pickupMapper,
                Clock.fixed(NOW, ZoneOffset.UTC));

        pickupId = UUID.randomUUID();
        pickup = new PickupRequest();
        pickup.setId(pickupId);
        pickup.setStatus(PickupStatus.FINDING_VENDOR);
        pickup.setAssignedVendorRef("V1");
        pickup.setAssignmentExpiresAt(NOW.plusSeconds(5));
    }

    @Nested
    @DisplayName("confirmVendorAcceptance Tests")
    class ConfirmVendorAcceptanceTests {

        @Test
        @DisplayName("should assign the pickup and drop its dispatch state")
        void shouldAssignAndCompleteDispatch() {
            // Arrange
            pickup.setStatus(PickupStatus.ASSIGNED);
            PickupResponse projection = PickupResponse.builder().id(pickupId).status(PickupStatus.ASSIGNED).build();
            when(transitions.confirmAssignment(pickupId, "V1")).thenReturn(Optional.of(pickup));
            when(pickupMapper.toPickupResponse(pickup)).thenReturn(projection);

            // Act
            PickupResponse response = arbiter.confirmVendorAcceptance(pickupId, "V1");

            // Assert
            assertThat(response).isSameAs(projection);
            verify(offerCoordinator).complete(pickupId);
        }

        @Test
        @DisplayName("should report conflict when another vendor holds the offer")
        void shouldConflictForOtherVendor() {
            // Arrange
            when(transitions.confirmAssignment(pickupId, "V2")).thenReturn(Optional.empty());
            when(pickupRequestRepository.findWithItemsById(pickupId)).thenReturn(Optional.of(pickup));

            // Act & Assert
            assertThatThrownBy(() -> arbiter.confirmVendorAcceptance(pickupId, "V2"))
                    .isInstanceOf(AssignmentConflictException.class)
                    .hasMessageContaining("not currently offered to vendor V2");
            verifyNoInteractions(offerCoordinator);
        }

        @Test
        @DisplayName("should report conflict when the offer expired exactly now")
        void shouldConflictAtExpiryBoundary() {
            // Arrange
            pickup.setAssignmentExpiresAt(NOW);
            when(transitions.confirmAssignment(pickupId, "V1")).thenReturn(Optional.empty());
            when(pickupRequestRepository.findWithItemsById(pickupId)).thenReturn(Optional.of(pickup));

            // Act & Assert
            assertThatThrownBy(() -> arbiter.confirmVendorAcceptance(pickupId, "V1"))
                    .isInstanceOf(AssignmentConflictException.class)
                    .hasMessageContaining("expired");
        }

        @Test
        @DisplayName("should report conflict when the pickup was already assigned")
        void shouldConflictWhenAlreadyAssigned() {
            // Arrange
            pickup.setStatus(PickupStatus.ASSIGNED);
            pickup.setAssignedVendorRef("V3");
            when(transitions.confirmAssignment(pickupId, "V1")).thenReturn(Optional.empty());
            when(pickupRequestRepository.findWithItemsById(pickupId)).thenReturn(Optional.of(pickup));

            // Act & Assert
            assertThatThrownBy(() -> arbiter.confirmVendorAcceptance(pickupId, "V1"))
                    .isInstanceOf(AssignmentConflictException.class)
                    .hasMessageContaining("ASSIGNED");
        }

        @Test
        @DisplayName("should throw ResourceNotFoundException for an unknown pickup")
        void shouldThrowForUnknownPickup() {
            // Arrange
            when(transitions.confirmAssignment(pickupId, "V1")).thenReturn(Optional.empty());
            when(pickupRequestRepository.findWithItemsById(pickupId)).thenReturn(Optional.empty());

            // Act & Assert
            assertThatThrownBy(() -> arbiter.confirmVendorAcceptance(pickupId, "V1"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("handleVendorRejection Tests")
    class HandleVendorRejectionTests {

        @Test
        @DisplayName("should record the rejection and redispatch before returning")
        void shouldRedispatchSynchronously() {
            // Arrange
            when(pickupRequestRepository.findWithItemsById(pickupId)).thenReturn(Optional.of(pickup));
            when(transitions.releaseOffer(pickupId, "V1", RejectionReason.EXPLICIT_REJECT)).thenReturn(true);
            PickupResponse projection = PickupResponse.builder().id(pickupId).build();
            when(pickupMapper.toPickupResponse(pickup)).thenReturn(projection);

            // Act
            RejectionOutcomeResponse outcome = arbiter.handleVendorRejection(pickupId, "V1");

            // Assert
            assertThat(outcome.isIgnored()).isFalse();
            assertThat(outcome.getPickup()).isSameAs(projection);
            InOrder inOrder = inOrder(transitions, offerCoordinator);
            inOrder.verify(transitions).releaseOffer(pickupId, "V1", RejectionReason.EXPLICIT_REJECT);
            inOrder.verify(offerCoordinator).invalidate(pickupId);
            inOrder.verify(offerCoordinator).dispatch(pickupId);
        }

        @Test
        @DisplayName("should ignore a rejection from a vendor that holds no offer")
        void shouldIgnoreStaleRejection() {
            // Arrange
            when(pickupRequestRepository.findWithItemsById(pickupId)).thenReturn(Optional.of(pickup));
            when(transitions.releaseOffer(pickupId, "V9", RejectionReason.EXPLICIT_REJECT)).thenReturn(false);

            // Act
            RejectionOutcomeResponse outcome = arbiter.handleVendorRejection(pickupId, "V9");

            // Assert
            assertThat(outcome.isIgnored()).isTrue();
            assertThat(outcome.getPickup()).isNull();
            verifyNoInteractions(offerCoordinator);
        }

        @Test
        @DisplayName("should throw ResourceNotFoundException for an unknown pickup")
        void shouldThrowForUnknownPickup() {
            // Arrange
            when(pickupRequestRepository.findWithItemsById(pickupId)).thenReturn(Optional.empty());

            // Act & Assert
            assertThatThrownBy(() -> arbiter.handleVendorRejection(pickupId, "V1"))
                    .isInstanceOf(ResourceNotFoundException.class);
            verify(transitions, never()).releaseOffer(any(), any(), any());
        }
    }
}
