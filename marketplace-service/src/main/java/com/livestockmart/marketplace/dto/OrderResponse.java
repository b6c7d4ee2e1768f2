package com.livestockmart.marketplace.dto;

import com.livestockmart.marketplace.model.Address;
import com.livestockmart.marketplace.model.OrderStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class OrderResponse {
    private UUID id;
    private UUID userId;
    private String customerName;
    private List<OrderItemResponse> items;
    private BigDecimal totalAmount;
    private OrderStatus status;
    private String rejectionReason;
    private Address shippingAddress;
    private boolean paymentProofAttached;
    private Instant proofUploadedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
