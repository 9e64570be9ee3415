package com.opsdash.realtimeservice.dto;

import lombok.Value;

/**
 * Inbox counters; {@code recent} covers the last 24 hours.
 */
@Value
public class NotificationStats {
    long unread;
    long total;
    long recent;
}
