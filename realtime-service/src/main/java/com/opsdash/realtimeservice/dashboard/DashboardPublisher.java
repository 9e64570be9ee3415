package com.opsdash.realtimeservice.dashboard;

import com.opsdash.realtimeservice.dto.DashboardSnapshot;
import com.opsdash.realtimeservice.dto.DashboardStatus;

/**
 * Delivers view output to the user who mounted it.
 */
public interface DashboardPublisher {

    void publishSnapshot(String userId, DashboardSnapshot snapshot);

    void publishStatus(String userId, DashboardStatus status);
}
