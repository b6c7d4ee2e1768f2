package com.livestockmart.marketplace.controller;

import com.livestockmart.marketplace.dto.ListingResponse;
import com.livestockmart.marketplace.model.ListingAvailability;
import com.livestockmart.marketplace.service.ListingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/listings")
@RequiredArgsConstructor
public class ListingController {

    private final ListingService listingService;

    @GetMapping
    public ResponseEntity<List<ListingResponse>> getListings(
            @RequestParam(required = false) ListingAvailability availability) {
        return ResponseEntity.ok(listingService.getListings(availability));
    }

    @GetMapping("/{listingId}")
    public ResponseEntity<ListingResponse> getListing(@PathVariable UUID listingId) {
        return ResponseEntity.ok(listingService.getListing(listingId));
    }
}
