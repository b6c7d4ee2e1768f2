package com.livestockmart.marketplace.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One line of a user's basket. Name and price are the client's copy taken when
 * the listing was added; the catalog stays authoritative at checkout.
 */
@Entity
@Table(name = "basket_items", uniqueConstraints = {
        @UniqueConstraint(name = "uk_basket_user_listing", columnNames = {"user_id", "listing_id"})
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BasketItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    @ToString.Include
    private UUID userId;

    @Column(name = "listing_id", nullable = false)
    @ToString.Include
    private UUID listingId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private BigDecimal price;

    private String category;

    private String breed;

    private String weight;

    @Builder.Default
    @Column(nullable = false)
    private boolean selected = true;

    @CreationTimestamp
    @Column(name = "added_at", updatable = false)
    private Instant addedAt;
}
