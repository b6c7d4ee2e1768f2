package com.livestockmart.marketplace.service;

import com.livestockmart.common.exception.ResourceNotFoundException;
import com.livestockmart.marketplace.dto.ReservationResult;
import com.livestockmart.marketplace.model.Listing;
import com.livestockmart.marketplace.model.ListingAvailability;
import com.livestockmart.marketplace.repository.ListingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.livestockmart.marketplace.model.ListingAvailability.AVAILABLE;
import static com.livestockmart.marketplace.model.ListingAvailability.RESERVED;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReservationCoordinatorImpl implements ReservationCoordinator {

    private final ListingRepository listingRepository;

    @Override
    @Transactional
    public ReservationResult reserve(Set<UUID> listingIds) {
        if (listingIds == null || listingIds.isEmpty()) {
            throw new IllegalArgumentException("At least one listing is required for a reservation");
        }

        // Same update order for every caller, so overlapping batches queue on the
        // first shared row instead of deadlocking
        List<UUID> ordered = listingIds.stream().sorted().toList();
        log.info("Reservation started: listingIds={}", ordered);

        Map<UUID, ListingAvailability> current = listingRepository.findAllById(ordered).stream()
                .collect(Collectors.toMap(Listing::getId, Listing::getAvailability));

        List<UUID> missing = ordered.stream()
                .filter(id -> !current.containsKey(id))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("Reservation refused, unknown listings: missing={}", missing);
            throw new ResourceNotFoundException("Listings not found: " + missing);
        }

        Set<UUID> unavailable = ordered.stream()
                .filter(id -> current.get(id) != AVAILABLE)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!unavailable.isEmpty()) {
            log.warn("Reservation refused before any update: unavailable={}", unavailable);
            return ReservationResult.conflict(unavailable);
        }

        List<UUID> flipped = new ArrayList<>();
        for (UUID listingId : ordered) {
            int updatedRows = listingRepository.compareAndSetAvailability(listingId, AVAILABLE, RESERVED);
            if (updatedRows == 0) {
                log.warn("Reservation lost race: listingId={}, flippedInBatch={}", listingId, flipped);
                rollBack(flipped);
                return ReservationResult.conflict(collectConflicts(listingId, ordered));
            }
            flipped.add(listingId);
        }

        log.info("Reservation completed: listingIds={}", ordered);
        return ReservationResult.reserved(listingIds);
    }

    @Override
    @Transactional
    public int release(Set<UUID> listingIds) {
        if (listingIds == null || listingIds.isEmpty()) {
            return 0;
        }
        int released = listingRepository.releaseAll(listingIds);
        log.info("Listings released: requested={}, released={}, listingIds={}",
                listingIds.size(), released, listingIds);
        return released;
    }

    private void rollBack(List<UUID> flipped) {
        for (UUID listingId : flipped) {
            int updatedRows = listingRepository.compareAndSetAvailability(listingId, RESERVED, AVAILABLE);
            if (updatedRows == 0) {
                // this batch still holds the row, so nobody else can have touched it
                log.error("Rollback of partial reservation found listing not RESERVED: listingId={}", listingId);
            }
        }
        if (!flipped.isEmpty()) {
            log.info("Partial reservation rolled back: listingIds={}", flipped);
        }
    }

    // The listing that lost the race plus any not-yet-tried listing that is
    // reserved by now, so the buyer can trim the basket in one go
    private Set<UUID> collectConflicts(UUID lostListingId, List<UUID> ordered) {
        Set<UUID> conflicts = new LinkedHashSet<>();
        conflicts.add(lostListingId);
        for (UUID other : ordered.subList(ordered.indexOf(lostListingId) + 1, ordered.size())) {
            listingRepository.findAvailabilityById(other)
                    .filter(availability -> availability != AVAILABLE)
                    .ifPresent(availability -> conflicts.add(other));
        }
        return conflicts;
    }
}
