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
 * A sellable animal in the catalog.
 *
 * Descriptive fields belong to catalog management. The availability column is
 * only ever written through ListingRepository's conditional updates, which the
 * reservation coordinator drives.
 */
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "listings", indexes = {
        @Index(name = "idx_listing_availability", columnList = "availability")
})
public class Listing {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(nullable = false)
    @ToString.Include
    private String name;

    // cattle, goat, sheep, poultry...
    private String category;

    private String breed;

    private String age;

    private String weight;

    @Column(nullable = false)
    private BigDecimal price;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @ToString.Include
    private ListingAvailability availability = ListingAvailability.AVAILABLE;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
