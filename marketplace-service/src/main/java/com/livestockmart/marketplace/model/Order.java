package com.livestockmart.marketplace.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_user_created", columnList = "user_id,created_at")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    // Token subject of the buyer
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "customer_name")
    private String customerName;

    // Snapshot of the listings at order time, never rewritten afterwards
    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    private List<OrderItem> items = new ArrayList<>();

    @Column(name = "total_amount", nullable = false, updatable = false)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @ToString.Include
    private OrderStatus status;

    // Empty unless status is PAYMENT_REJECTED
    @Column(name = "rejection_reason", nullable = false, length = 300)
    private String rejectionReason = "";

    @Embedded
    private Address shippingAddress;

    // Set whenever a payment proof row exists for this order
    @Column(name = "proof_uploaded_at")
    private Instant proofUploadedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Two staff/owner writes racing on the same order: the second one fails
    // with OptimisticLockingFailureException instead of overwriting the first
    @Version
    @Column(name = "version")
    private Long version;

    public void addItem(OrderItem item) {
        item.setOrder(this);
        item.setLineNumber(items.size());
        items.add(item);
    }

    public List<UUID> listingIds() {
        return items.stream().map(OrderItem::getListingId).toList();
    }
}
