package com.livestockmart.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Contract for order lifecycle events.
 *
 * Used for:
 * - order.created (oldStatus is null)
 * - order.status_changed
 * - order.cancelled (listingIds were released back to the catalog)
 * - order.proof_submitted
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusChangeContract {
    private UUID orderId;
    private UUID userId;
    private String oldStatus;
    private String status;         // PROCESSING, PAYMENT_REJECTED, SHIPPED, DELIVERED, CANCELLED
    private BigDecimal totalAmount;
    private List<UUID> listingIds;
    private Instant occurredAt;
}
