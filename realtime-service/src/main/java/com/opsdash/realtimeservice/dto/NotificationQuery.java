package com.opsdash.realtimeservice.dto;

import com.opsdash.realtimeservice.model.NotificationType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Inbox filters. Empty {@code types} means every type; {@code from} is inclusive,
 * {@code to} exclusive.
 */
@Value
@Builder
public class NotificationQuery {
    @Builder.Default
    Set<NotificationType> types = Set.of();
    Instant from;
    Instant to;
    boolean unreadOnly;
    @Builder.Default
    int page = 0;
    @Builder.Default
    int size = 20;

    public static NotificationQuery firstPage(int size) {
        return NotificationQuery.builder().size(size).build();
    }
}
