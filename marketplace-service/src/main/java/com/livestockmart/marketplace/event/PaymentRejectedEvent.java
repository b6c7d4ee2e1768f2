package com.livestockmart.marketplace.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * In-process event raised when staff reject an order's payment proof.
 * Delivered to listeners only after the rejection has committed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRejectedEvent {
    private UUID orderId;
    private UUID userId;
    private String reason;
}
