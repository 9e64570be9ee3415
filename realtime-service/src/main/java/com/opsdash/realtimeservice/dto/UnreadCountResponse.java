package com.opsdash.realtimeservice.dto;

import lombok.Value;

@Value
public class UnreadCountResponse {
    long unreadCount;
}
