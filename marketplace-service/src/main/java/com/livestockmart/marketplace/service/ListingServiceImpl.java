package com.livestockmart.marketplace.service;

import com.livestockmart.common.exception.ResourceNotFoundException;
import com.livestockmart.marketplace.dto.ListingResponse;
import com.livestockmart.marketplace.mapper.ListingMapper;
import com.livestockmart.marketplace.model.Listing;
import com.livestockmart.marketplace.model.ListingAvailability;
import com.livestockmart.marketplace.repository.ListingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ListingServiceImpl implements ListingService {

    private final ListingRepository listingRepository;
    private final ListingMapper listingMapper;

    @Override
    public List<ListingResponse> getListings(ListingAvailability availability) {
        List<Listing> listings = availability == null
                ? listingRepository.findAllByOrderByCreatedAtDesc()
                : listingRepository.findByAvailabilityOrderByCreatedAtDesc(availability);
        return listings.stream()
                .map(listingMapper::toListingResponse)
                .toList();
    }

    @Override
    public ListingResponse getListing(UUID listingId) {
        return listingRepository.findById(listingId)
                .map(listingMapper::toListingResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Listing not found with id: " + listingId));
    }

    @Override
    public ListingAvailability getAvailability(UUID listingId) {
        return listingRepository.findAvailabilityById(listingId)
                .orElseThrow(() -> new ResourceNotFoundException("Listing not found with id: " + listingId));
    }
}
