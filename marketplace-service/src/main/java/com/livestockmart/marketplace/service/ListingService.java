package com.livestockmart.marketplace.service;

import com.livestockmart.marketplace.dto.ListingResponse;
import com.livestockmart.marketplace.model.ListingAvailability;

import java.util.List;
import java.util.UUID;

public interface ListingService {

    /**
     * Catalog listing, newest first. A null filter returns every listing.
     */
    List<ListingResponse> getListings(ListingAvailability availability);

    ListingResponse getListing(UUID listingId);

    ListingAvailability getAvailability(UUID listingId);
}
