package com.livestockmart.marketplace.repository;

import com.livestockmart.marketplace.model.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    /**
     * Whole inbox of a user, newest first.
     */
    List<Notification> findByUserIdOrderByCreatedAtDesc(UUID userId);

    /**
     * Notifications the user has not opened yet, newest first.
     */
    List<Notification> findByUserIdAndSeenFalseOrderByCreatedAtDesc(UUID userId);

    long countByUserId(UUID userId);
}
