package com.livestockmart.marketplace.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Outcome of one reservation batch: either every requested listing is now
 * reserved, or none of them is and conflictingIds names the ones that blocked it.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReservationResult {

    private final Set<UUID> reservedIds;
    private final Set<UUID> conflictingIds;

    public static ReservationResult reserved(Set<UUID> reservedIds) {
        return new ReservationResult(Collections.unmodifiableSet(new LinkedHashSet<>(reservedIds)), Set.of());
    }

    public static ReservationResult conflict(Set<UUID> conflictingIds) {
        return new ReservationResult(Set.of(), Collections.unmodifiableSet(new LinkedHashSet<>(conflictingIds)));
    }

    public boolean isSuccessful() {
        return conflictingIds.isEmpty();
    }
}
