package com.opsdash.realtimeservice.dto;

import com.opsdash.realtimeservice.dashboard.DashboardViewKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full content of a view at one point in time. Clients replace their state with it.
 *
 * Role dashboards fill {@code tables}; inbox views fill {@code notifications} and
 * {@code unreadCount}. {@code version} increases with every snapshot of the same mount.
 */
@Value
@Builder(toBuilder = true)
public class DashboardSnapshot {
    String viewId;
    DashboardViewKind kind;
    long version;
    Instant loadedAt;
    @Builder.Default
    Map<String, List<Map<String, Object>>> tables = Map.of();
    @Builder.Default
    List<String> unavailableTables = List.of();
    List<NotificationDto> notifications;
    Long unreadCount;
}
