package com.livestockmart.marketplace.repository;

import com.livestockmart.marketplace.model.BasketItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BasketItemRepository extends JpaRepository<BasketItem, UUID> {

    List<BasketItem> findByUserIdOrderByAddedAtAsc(UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM BasketItem b WHERE b.userId = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);
}
