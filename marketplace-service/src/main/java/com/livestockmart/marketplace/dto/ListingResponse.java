package com.livestockmart.marketplace.dto;

import com.livestockmart.marketplace.model.ListingAvailability;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class ListingResponse {
    private UUID id;
    private String name;
    private String category;
    private String breed;
    private String age;
    private String weight;
    private BigDecimal price;
    private ListingAvailability availability;
    private Instant createdAt;
}
