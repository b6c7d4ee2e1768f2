package com.livestockmart.marketplace.exception;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Exception thrown when at least one listing of a basket is no longer available.
 * Carries exactly the listing ids that blocked the reservation; nothing was reserved.
 * HTTP Status: 409 Conflict
 */
public class ReservationConflictException extends RuntimeException {

    private final Set<UUID> conflictingIds;

    public ReservationConflictException(Set<UUID> conflictingIds) {
        super("Listings are no longer available: " + conflictingIds);
        this.conflictingIds = Collections.unmodifiableSet(new LinkedHashSet<>(conflictingIds));
    }

    public Set<UUID> getConflictingIds() {
        return conflictingIds;
    }
}
