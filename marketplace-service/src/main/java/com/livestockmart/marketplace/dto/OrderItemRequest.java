package com.livestockmart.marketplace.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
public class OrderItemRequest {
    @NotNull(message = "Listing ID cannot be null")
    private UUID listingId;

    // price the buyer saw when adding the listing to the basket
    @NotNull(message = "Price cannot be null")
    @DecimalMin(value = "0.0", message = "Price cannot be negative")
    private BigDecimal price;
}
