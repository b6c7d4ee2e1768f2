package com.livestockmart.marketplace.service;

import com.livestockmart.marketplace.dto.OrderResponse;
import com.livestockmart.marketplace.dto.PaymentProofContent;
import com.livestockmart.marketplace.dto.PaymentProofUpload;
import com.livestockmart.marketplace.model.Order;

import java.util.UUID;

public interface PaymentProofService {

    String DEFAULT_REJECTION_REASON = "Invalid payment proof.";

    /**
     * Checks size and media type of an upload without storing anything.
     *
     * @throws com.livestockmart.marketplace.exception.InvalidPaymentProofException if the upload is unusable
     */
    void validateUpload(PaymentProofUpload upload);

    /**
     * Stores or replaces the proof of an order the caller already holds inside a
     * transaction. Clears any rejection reason and moves PAYMENT_REJECTED back to PROCESSING.
     */
    void attachProof(Order order, PaymentProofUpload upload);

    /**
     * Buyer-side resubmission after a rejection (or replacing the proof while still PROCESSING).
     */
    OrderResponse resubmitProof(UUID orderId, UUID requesterId, PaymentProofUpload upload);

    /**
     * Staff rejection of the proof. Only legal while the order is PROCESSING.
     * A blank reason is replaced by {@link #DEFAULT_REJECTION_REASON}.
     * The buyer is notified once the rejection has committed.
     */
    OrderResponse rejectPayment(UUID orderId, String reason);

    PaymentProofContent getProof(UUID orderId);

    PaymentProofContent getProofForOwner(UUID orderId, UUID requesterId);
}
