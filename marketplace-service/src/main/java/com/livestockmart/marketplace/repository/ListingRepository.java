package com.livestockmart.marketplace.repository;

import com.livestockmart.marketplace.model.Listing;
import com.livestockmart.marketplace.model.ListingAvailability;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ListingRepository extends JpaRepository<Listing, UUID> {

    List<Listing> findAllByOrderByCreatedAtDesc();

    List<Listing> findByAvailabilityOrderByCreatedAtDesc(ListingAvailability availability);

    @Query("SELECT l.availability FROM Listing l WHERE l.id = :id")
    Optional<ListingAvailability> findAvailabilityById(@Param("id") UUID id);

    // Check-and-set in one statement: 1 row when the caller won the listing, 0 when
    // its availability was not the expected value any more
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Listing l SET l.availability = :next WHERE l.id = :id AND l.availability = :expected")
    int compareAndSetAvailability(@Param("id") UUID id,
                                  @Param("expected") ListingAvailability expected,
                                  @Param("next") ListingAvailability next);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Listing l SET l.availability = com.livestockmart.marketplace.model.ListingAvailability.AVAILABLE "
            + "WHERE l.id IN :ids AND l.availability = com.livestockmart.marketplace.model.ListingAvailability.RESERVED")
    int releaseAll(@Param("ids") Collection<UUID> ids);
}
