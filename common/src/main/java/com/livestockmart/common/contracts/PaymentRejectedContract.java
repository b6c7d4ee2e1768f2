package com.livestockmart.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Contract for order.payment_rejected events.
 * Listings stay reserved: a rejected order is expected to be fixed and resubmitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRejectedContract {
    private UUID orderId;
    private UUID userId;
    private String reason;
    private Instant occurredAt;
}
