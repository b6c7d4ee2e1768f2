package com.livestockmart.marketplace.service;

import com.livestockmart.common.exception.AccessDeniedException;
import com.livestockmart.common.exception.ResourceNotFoundException;
import com.livestockmart.marketplace.dto.NotificationDto;
import com.livestockmart.marketplace.dto.NotificationRequest;
import com.livestockmart.marketplace.mapper.NotificationMapper;
import com.livestockmart.marketplace.model.Notification;
import com.livestockmart.marketplace.model.NotificationSeverity;
import com.livestockmart.marketplace.repository.NotificationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private NotificationMapper notificationMapper;

    @InjectMocks
    private NotificationService notificationService;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
    }

    @Test
    void notify_AppendsUnseenRecord() {
        UUID orderId = UUID.randomUUID();
        when(notificationRepository.save(any(Notification.class))).thenAnswer(i -> i.getArgument(0));
        when(notificationMapper.toDto(any())).thenReturn(NotificationDto.builder().build());

        notificationService.notify(userId, NotificationRequest.builder()
                .orderId(orderId)
                .title("Payment Rejected")
                .message("Order #abcdef proof rejected: Blurry")
                .icon("alert-circle")
                .severity(NotificationSeverity.DANGER)
                .build());

        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(captor.capture());
        Notification saved = captor.getValue();
        assertThat(saved.getUserId()).isEqualTo(userId);
        assertThat(saved.getOrderId()).isEqualTo(orderId);
        assertThat(saved.isSeen()).isFalse();
        assertThat(saved.getSeverity()).isEqualTo(NotificationSeverity.DANGER);
    }

    @Test
    void getUnseenNotifications_MapsEveryRecord() {
        Notification first = Notification.builder().id(UUID.randomUUID()).userId(userId).build();
        Notification second = Notification.builder().id(UUID.randomUUID()).userId(userId).build();
        when(notificationRepository.findByUserIdAndSeenFalseOrderByCreatedAtDesc(userId))
                .thenReturn(List.of(first, second));
        when(notificationMapper.toDto(any())).thenReturn(NotificationDto.builder().build());

        assertThat(notificationService.getUnseenNotifications(userId)).hasSize(2);
    }

    @Test
    void markAsSeen_Owner_FlipsFlag() {
        Notification notification = Notification.builder().id(UUID.randomUUID()).userId(userId).build();
        when(notificationRepository.findById(notification.getId())).thenReturn(Optional.of(notification));
        when(notificationRepository.save(notification)).thenReturn(notification);

        notificationService.markAsSeen(notification.getId(), userId);

        assertThat(notification.isSeen()).isTrue();
    }

    @Test
    void markAsSeen_OtherUser_ThrowsAccessDenied() {
        Notification notification = Notification.builder().id(UUID.randomUUID()).userId(UUID.randomUUID()).build();
        when(notificationRepository.findById(notification.getId())).thenReturn(Optional.of(notification));

        assertThatThrownBy(() -> notificationService.markAsSeen(notification.getId(), userId))
                .isInstanceOf(AccessDeniedException.class);

        assertThat(notification.isSeen()).isFalse();
        verify(notificationRepository, never()).save(any());
    }

    @Test
    void markAsSeen_Unknown_ThrowsNotFound() {
        UUID id = UUID.randomUUID();
        when(notificationRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> notificationService.markAsSeen(id, userId))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
