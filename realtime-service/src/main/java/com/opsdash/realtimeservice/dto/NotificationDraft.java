package com.opsdash.realtimeservice.dto;

import com.opsdash.realtimeservice.model.NotificationPriority;
import com.opsdash.realtimeservice.model.NotificationType;
import lombok.Builder;
import lombok.Value;

/**
 * A notification ready to be stored. Built by NotificationDrafts; the recipient is left
 * empty for broadcasts and filled in per user.
 */
@Value
@Builder(toBuilder = true)
public class NotificationDraft {
    String recipientId;
    NotificationType type;
    String title;
    String message;
    @Builder.Default
    NotificationPriority priority = NotificationPriority.MEDIUM;
    RelatedEntity relatedEntity;

    public NotificationDraft forRecipient(String recipientId) {
        return toBuilder().recipientId(recipientId).build();
    }
}
