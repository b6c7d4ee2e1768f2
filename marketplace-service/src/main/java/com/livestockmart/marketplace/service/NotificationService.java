package com.livestockmart.marketplace.service;

import com.livestockmart.common.exception.AccessDeniedException;
import com.livestockmart.common.exception.ResourceNotFoundException;
import com.livestockmart.marketplace.dto.NotificationDto;
import com.livestockmart.marketplace.dto.NotificationRequest;
import com.livestockmart.marketplace.mapper.NotificationMapper;
import com.livestockmart.marketplace.model.Notification;
import com.livestockmart.marketplace.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Per-user inbox. Records are appended by order-side events and read back
 * by the inbox owner.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final NotificationMapper notificationMapper;

    /**
     * Appends one unseen notification to the user's inbox.
     * Runs in its own transaction: a failure here never touches the order
     * change that triggered it.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public NotificationDto notify(UUID userId, NotificationRequest request) {
        Notification notification = Notification.builder()
                .userId(userId)
                .orderId(request.getOrderId())
                .title(request.getTitle())
                .message(request.getMessage())
                .icon(request.getIcon())
                .severity(request.getSeverity())
                .seen(false)
                .build();

        Notification saved = notificationRepository.save(notification);
        log.info("Notification created: id={}, userId={}, orderId={}, severity={}",
                saved.getId(), userId, request.getOrderId(), request.getSeverity());
        return notificationMapper.toDto(saved);
    }

    @Transactional(readOnly = true)
    public List<NotificationDto> getNotifications(UUID userId) {
        return notificationRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(notificationMapper::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<NotificationDto> getUnseenNotifications(UUID userId) {
        return notificationRepository.findByUserIdAndSeenFalseOrderByCreatedAtDesc(userId).stream()
                .map(notificationMapper::toDto)
                .toList();
    }

    @Transactional
    public NotificationDto markAsSeen(UUID notificationId, UUID userId) {
        Notification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> new ResourceNotFoundException("Notification not found: " + notificationId));

        if (!notification.getUserId().equals(userId)) {
            log.warn("Unauthorized notification access: notificationId={}, userId={}", notificationId, userId);
            throw new AccessDeniedException("Notification belongs to another user");
        }

        notification.setSeen(true);
        return notificationMapper.toDto(notificationRepository.save(notification));
    }
}
