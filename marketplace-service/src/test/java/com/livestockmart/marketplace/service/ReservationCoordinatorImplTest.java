package com.livestockmart.marketplace.service;

import com.livestockmart.common.exception.ResourceNotFoundException;
import com.livestockmart.marketplace.dto.ReservationResult;
import com.livestockmart.marketplace.model.Listing;
import com.livestockmart.marketplace.model.ListingAvailability;
import com.livestockmart.marketplace.repository.ListingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import static com.livestockmart.marketplace.model.ListingAvailability.AVAILABLE;
import static com.livestockmart.marketplace.model.ListingAvailability.RESERVED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReservationCoordinatorImplTest {

    @Mock
    private ListingRepository listingRepository;

    @InjectMocks
    private ReservationCoordinatorImpl reservationCoordinator;

    // sorted, so the expected update order is first, second, third
    private UUID first;
    private UUID second;
    private UUID third;

    @BeforeEach
    void setUp() {
        List<UUID> ids = Stream.generate(UUID::randomUUID).limit(3).sorted().toList();
        first = ids.get(0);
        second = ids.get(1);
        third = ids.get(2);
    }

    private Listing listing(UUID id, ListingAvailability availability) {
        return Listing.builder()
                .id(id)
                .name("Goat " + id.toString().substring(0, 4))
                .price(BigDecimal.valueOf(250))
                .availability(availability)
                .build();
    }

    @Test
    void reserve_AllAvailable_FlipsEveryListingInSortedOrder() {
        when(listingRepository.findAllById(anyIterable())).thenReturn(List.of(
                listing(third, AVAILABLE), listing(first, AVAILABLE), listing(second, AVAILABLE)));
        when(listingRepository.compareAndSetAvailability(any(), eq(AVAILABLE), eq(RESERVED))).thenReturn(1);

        ReservationResult result = reservationCoordinator.reserve(Set.of(third, first, second));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getReservedIds()).containsExactlyInAnyOrder(first, second, third);
        InOrder inOrder = inOrder(listingRepository);
        inOrder.verify(listingRepository).compareAndSetAvailability(first, AVAILABLE, RESERVED);
        inOrder.verify(listingRepository).compareAndSetAvailability(second, AVAILABLE, RESERVED);
        inOrder.verify(listingRepository).compareAndSetAvailability(third, AVAILABLE, RESERVED);
    }

    @Test
    void reserve_ListingAlreadyReserved_ReturnsConflictWithoutAnyUpdate() {
        when(listingRepository.findAllById(anyIterable())).thenReturn(List.of(
                listing(first, AVAILABLE), listing(second, RESERVED)));

        ReservationResult result = reservationCoordinator.reserve(Set.of(first, second));

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getConflictingIds()).containsExactly(second);
        assertThat(result.getReservedIds()).isEmpty();
        verify(listingRepository, never()).compareAndSetAvailability(any(), any(), any());
    }

    @Test
    void reserve_LostRaceMidBatch_RevertsAlreadyFlippedListings() {
        when(listingRepository.findAllById(anyIterable())).thenReturn(List.of(
                listing(first, AVAILABLE), listing(second, AVAILABLE), listing(third, AVAILABLE)));
        when(listingRepository.compareAndSetAvailability(first, AVAILABLE, RESERVED)).thenReturn(1);
        // another order took the second listing after the pre-check
        when(listingRepository.compareAndSetAvailability(second, AVAILABLE, RESERVED)).thenReturn(0);
        when(listingRepository.compareAndSetAvailability(first, RESERVED, AVAILABLE)).thenReturn(1);
        when(listingRepository.findAvailabilityById(third)).thenReturn(Optional.of(AVAILABLE));

        ReservationResult result = reservationCoordinator.reserve(Set.of(first, second, third));

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getConflictingIds()).containsExactly(second);
        verify(listingRepository).compareAndSetAvailability(first, RESERVED, AVAILABLE);
        verify(listingRepository, never()).compareAndSetAvailability(third, AVAILABLE, RESERVED);
    }

    @Test
    void reserve_LostRace_ReportsLaterListingsThatAreAlsoTaken() {
        when(listingRepository.findAllById(anyIterable())).thenReturn(List.of(
                listing(first, AVAILABLE), listing(second, AVAILABLE), listing(third, AVAILABLE)));
        when(listingRepository.compareAndSetAvailability(first, AVAILABLE, RESERVED)).thenReturn(0);
        when(listingRepository.findAvailabilityById(second)).thenReturn(Optional.of(AVAILABLE));
        when(listingRepository.findAvailabilityById(third)).thenReturn(Optional.of(RESERVED));

        ReservationResult result = reservationCoordinator.reserve(Set.of(first, second, third));

        assertThat(result.getConflictingIds()).containsExactly(first, third);
        verify(listingRepository, times(1)).compareAndSetAvailability(any(), any(), any());
    }

    @Test
    void reserve_UnknownListing_ThrowsNotFound() {
        when(listingRepository.findAllById(anyIterable())).thenReturn(List.of(listing(first, AVAILABLE)));

        assertThatThrownBy(() -> reservationCoordinator.reserve(Set.of(first, second)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining(second.toString());

        verify(listingRepository, never()).compareAndSetAvailability(any(), any(), any());
    }

    @Test
    void reserve_EmptyBatch_Throws() {
        assertThatThrownBy(() -> reservationCoordinator.reserve(Set.of()))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(listingRepository);
    }

    @Test
    void release_DelegatesToBulkRelease() {
        when(listingRepository.releaseAll(anyCollection())).thenReturn(2);

        int released = reservationCoordinator.release(Set.of(first, second));

        assertThat(released).isEqualTo(2);
        verify(listingRepository).releaseAll(Set.of(first, second));
    }

    @Test
    void release_EmptySet_DoesNothing() {
        assertThat(reservationCoordinator.release(Set.of())).isZero();

        verifyNoInteractions(listingRepository);
    }
}
