package com.livestockmart.marketplace.service;

import com.livestockmart.marketplace.dto.ReservationResult;

import java.util.Set;
import java.util.UUID;

public interface ReservationCoordinator {

    /**
     * Claims every listing of the batch for one order, or none of them.
     * Each listing is flipped AVAILABLE -> RESERVED with a single conditional
     * update, so two overlapping batches can never both win the same listing.
     * On failure every listing already flipped by this batch is put back to
     * AVAILABLE before returning, and the result names the blocking ids.
     *
     * @throws com.livestockmart.common.exception.ResourceNotFoundException if a listing does not exist
     */
    ReservationResult reserve(Set<UUID> listingIds);

    /**
     * Puts reserved listings back on sale. Idempotent: listings that are already
     * AVAILABLE are left alone.
     *
     * @return number of listings that actually changed
     */
    int release(Set<UUID> listingIds);
}
