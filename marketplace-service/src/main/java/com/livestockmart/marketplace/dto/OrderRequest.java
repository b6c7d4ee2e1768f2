package com.livestockmart.marketplace.dto;

import com.livestockmart.marketplace.model.Address;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
public class OrderRequest {
    @NotEmpty(message = "Order must contain at least one item")
    @Valid
    private List<OrderItemRequest> items;

    @NotNull(message = "Total cannot be null")
    @DecimalMin(value = "0.0", message = "Total cannot be negative")
    private BigDecimal total;

    @NotNull(message = "Shipping address cannot be null")
    @Valid
    private Address shippingAddress;
}
