package com.livestockmart.marketplace.dto;

import com.livestockmart.marketplace.model.NotificationSeverity;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * What to append to a user's inbox. orderId is optional.
 */
@Data
@Builder
public class NotificationRequest {
    private UUID orderId;
    private String title;
    private String message;
    private String icon;
    private NotificationSeverity severity;
}
