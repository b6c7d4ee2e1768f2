package com.livestockmart.marketplace.controller;

import com.livestockmart.marketplace.dto.NotificationDto;
import com.livestockmart.marketplace.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Inbox of the authenticated user.
 */
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public ResponseEntity<List<NotificationDto>> getNotifications(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(notificationService.getNotifications(UUID.fromString(jwt.getSubject())));
    }

    @GetMapping("/unseen")
    public ResponseEntity<List<NotificationDto>> getUnseenNotifications(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(notificationService.getUnseenNotifications(UUID.fromString(jwt.getSubject())));
    }

    @PutMapping("/{notificationId}/seen")
    public ResponseEntity<NotificationDto> markAsSeen(
            @PathVariable UUID notificationId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(notificationService.markAsSeen(notificationId, UUID.fromString(jwt.getSubject())));
    }
}
