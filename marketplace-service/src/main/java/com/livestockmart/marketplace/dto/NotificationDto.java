package com.livestockmart.marketplace.dto;

import com.livestockmart.marketplace.model.NotificationSeverity;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * DTO for inbox responses.
 */
@Data
@Builder
public class NotificationDto {
    private UUID id;
    private UUID orderId;
    private String title;
    private String message;
    private String icon;
    private NotificationSeverity severity;
    private String color;
    private boolean seen;
    private Instant createdAt;
}
