package com.opsdash.realtimeservice.controller;

import com.opsdash.common.result.Result;
import com.opsdash.realtimeservice.config.WebSocketAuthInterceptor;
import com.opsdash.realtimeservice.dashboard.DashboardView;
import com.opsdash.realtimeservice.dashboard.DashboardViewManager;
import com.opsdash.realtimeservice.dto.MountDashboardRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.Map;

/**
 * STOMP endpoints for mounting and unmounting dashboard views.
 *
 * Client usage:
 * <pre>
 * stompClient.subscribe('/user/queue/dashboard/main', onSnapshot);
 * stompClient.subscribe('/user/queue/dashboard/main/status', onStatus);
 * stompClient.send('/app/dashboard/mount', {}, JSON.stringify({ viewId: 'main', kind: 'ROLE_DASHBOARD' }));
 * </pre>
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class DashboardController {

    private final DashboardViewManager dashboardViewManager;

    @MessageMapping("/dashboard/mount")
    public void mount(@Payload MountDashboardRequest request, Principal principal,
                      SimpMessageHeaderAccessor headerAccessor) {
        if (principal == null) {
            log.warn("Dashboard mount attempt without authentication");
            return;
        }

        String role = roleOf(headerAccessor);
        log.info("Dashboard mount requested: userId={}, role={}, viewId={}, kind={}",
                principal.getName(), role, request.getViewId(), request.getKind());

        Result<DashboardView> result = dashboardViewManager.mount(
                headerAccessor.getSessionId(), principal.getName(), role, request.getViewId(), request.getKind());
        if (result.isFailure()) {
            log.warn("Dashboard mount rejected: userId={}, error={}", principal.getName(), result.getError().getMessage());
        }
    }

    @MessageMapping("/dashboard/unmount")
    public void unmount(@Payload MountDashboardRequest request, Principal principal,
                        SimpMessageHeaderAccessor headerAccessor) {
        boolean released = dashboardViewManager.unmount(headerAccessor.getSessionId(), request.getViewId());
        log.info("Dashboard unmount: userId={}, viewId={}, released={}",
                principal != null ? principal.getName() : null, request.getViewId(), released);
    }

    private String roleOf(SimpMessageHeaderAccessor headerAccessor) {
        Map<String, Object> attributes = headerAccessor.getSessionAttributes();
        Object role = attributes != null ? attributes.get(WebSocketAuthInterceptor.SESSION_ROLE_ATTRIBUTE) : null;
        return role != null ? role.toString() : null;
    }
}
