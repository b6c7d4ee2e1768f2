package com.livestockmart.marketplace.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "order_items")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    private Order order;

    // Basket order as submitted by the buyer
    @Column(name = "line_number", nullable = false, updatable = false)
    private int lineNumber;

    @Column(name = "listing_id", nullable = false, updatable = false)
    @ToString.Include
    private UUID listingId;

    @Column(nullable = false, updatable = false)
    @ToString.Include
    private String name;

    @Column(nullable = false, updatable = false)
    private BigDecimal price;

    @Column(updatable = false)
    private String category;

    @Column(updatable = false)
    private String breed;

    @Column(updatable = false)
    private String weight;

    public static OrderItem snapshotOf(Listing listing) {
        OrderItem item = new OrderItem();
        item.setListingId(listing.getId());
        item.setName(listing.getName());
        item.setPrice(listing.getPrice());
        item.setCategory(listing.getCategory());
        item.setBreed(listing.getBreed());
        item.setWeight(listing.getWeight());
        return item;
    }
}
