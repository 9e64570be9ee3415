package com.opsdash.realtimeservice.dashboard;

import com.opsdash.realtimeservice.dto.DashboardSnapshot;
import com.opsdash.realtimeservice.dto.DashboardStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes snapshots to /user/queue/dashboard/{viewId} and status to
 * /user/queue/dashboard/{viewId}/status.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StompDashboardPublisher implements DashboardPublisher {

    static final String DESTINATION_PREFIX = "/queue/dashboard/";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void publishSnapshot(String userId, DashboardSnapshot snapshot) {
        messagingTemplate.convertAndSendToUser(userId, DESTINATION_PREFIX + snapshot.getViewId(), snapshot);
        log.debug("Snapshot sent: userId={}, viewId={}, version={}", userId, snapshot.getViewId(), snapshot.getVersion());
    }

    @Override
    public void publishStatus(String userId, DashboardStatus status) {
        messagingTemplate.convertAndSendToUser(userId, DESTINATION_PREFIX + status.getViewId() + "/status", status);
        log.debug("Status sent: userId={}, viewId={}, connected={}", userId, status.getViewId(), status.isConnected());
    }
}
