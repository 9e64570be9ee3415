package com.opsdash.realtimeservice.dto;

import com.opsdash.realtimeservice.model.NotificationPriority;
import com.opsdash.realtimeservice.model.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Notification as returned by REST and pushed in inbox snapshots.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationDto {
    private UUID id;
    private String recipientId;
    private NotificationType type;
    private String title;
    private String message;
    private NotificationPriority priority;
    private Boolean isRead;
    private Instant readAt;
    private RelatedEntity relatedEntity;
    private Instant createdAt;
}
