package com.livestockmart.marketplace.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Opaque payment evidence attached to an order. At most one per order: a
 * resubmission overwrites the previous row.
 */
@Entity
@Table(name = "payment_proofs")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentProof {

    @Id
    @Column(name = "order_id")
    @ToString.Include
    private UUID orderId;

    @Column(name = "content_type", nullable = false, length = 100)
    @ToString.Include
    private String contentType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(nullable = false)
    private byte[] content;

    @Column(name = "uploaded_at", nullable = false)
    private Instant uploadedAt;
}
