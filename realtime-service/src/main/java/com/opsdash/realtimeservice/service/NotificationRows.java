package com.opsdash.realtimeservice.service;

import com.opsdash.realtimeservice.model.Notification;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row image of a notification as published on the change feed, keyed by column name.
 */
final class NotificationRows {

    static final String TABLE = "notifications";

    private NotificationRows() {
    }

    static Map<String, Object> toRow(Notification notification) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", notification.getId() != null ? notification.getId().toString() : null);
        row.put("recipient_id", notification.getRecipientId());
        row.put("type", notification.getType() != null ? notification.getType().getValue() : null);
        row.put("title", notification.getTitle());
        row.put("message", notification.getMessage());
        row.put("priority", notification.getPriority() != null ? notification.getPriority().getValue() : null);
        row.put("is_read", notification.getIsRead());
        row.put("read_at", notification.getReadAt() != null ? notification.getReadAt().toString() : null);
        row.put("related_entity_type", notification.getRelatedEntityType());
        row.put("related_entity_id", notification.getRelatedEntityId());
        row.put("created_at", notification.getCreatedAt() != null ? notification.getCreatedAt().toString() : null);
        return row;
    }
}
