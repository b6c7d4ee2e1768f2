package com.livestockmart.marketplace.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
public class OrderItemResponse {
    private UUID listingId;
    private String name;
    private BigDecimal price; // catalog price at order time
    private String category;
    private String breed;
    private String weight;
}
