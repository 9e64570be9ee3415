package com.opsdash.realtimeservice.dashboard;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Tears down every view of a WebSocket session when it disconnects.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DashboardSessionListener {

    private final DashboardViewManager dashboardViewManager;

    @EventListener
    public void onSessionDisconnect(SessionDisconnectEvent event) {
        int released = dashboardViewManager.unmountSession(event.getSessionId());
        if (released > 0) {
            log.info("Session disconnected, views released: sessionId={}, views={}", event.getSessionId(), released);
        }
    }
}
