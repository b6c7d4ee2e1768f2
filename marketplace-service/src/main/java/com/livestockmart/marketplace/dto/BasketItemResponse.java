package com.livestockmart.marketplace.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class BasketItemResponse {
    private UUID listingId;
    private String name;
    private BigDecimal price;
    private String category;
    private String breed;
    private String weight;
    private boolean selected;
    private Instant addedAt;
}
