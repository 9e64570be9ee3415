package com.opsdash.realtimeservice.dto;

import com.opsdash.realtimeservice.dashboard.DashboardState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Connection status of a view. When {@code connected} is false the client keeps showing the
 * last snapshot and may fall back to polling.
 */
@Value
@Builder
public class DashboardStatus {
    String viewId;
    DashboardState state;
    boolean connected;
    String error;
    @Builder.Default
    List<String> failedChannels = List.of();
    Instant timestamp;
}
