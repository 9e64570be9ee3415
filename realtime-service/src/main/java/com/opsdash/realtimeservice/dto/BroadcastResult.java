package com.opsdash.realtimeservice.dto;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a broadcast: how many users were addressed and which ones did not get it.
 */
@Value
public class BroadcastResult {
    int attempted;
    List<NotificationDto> delivered;
    List<String> failedRecipientIds;
}
