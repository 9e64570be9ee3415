package com.opsdash.realtimeservice.controller;

import com.opsdash.realtimeservice.dashboard.DashboardViewManager;
import com.opsdash.realtimeservice.dto.RealtimeStatusResponse;
import com.opsdash.realtimeservice.registry.HealthStatus;
import com.opsdash.realtimeservice.registry.SubscriptionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Real-time connectivity for clients deciding whether to fall back to polling.
 */
@RestController
@RequestMapping("/api/v1/realtime")
@RequiredArgsConstructor
public class RealtimeHealthController {

    private final SubscriptionRegistry subscriptionRegistry;
    private final DashboardViewManager dashboardViewManager;

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        HealthStatus status = subscriptionRegistry.healthCheck();
        return ResponseEntity.status(status.isConnected() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(status);
    }

    @GetMapping("/status")
    public ResponseEntity<RealtimeStatusResponse> status() {
        return ResponseEntity.ok(new RealtimeStatusResponse(
                subscriptionRegistry.getStatus(), dashboardViewManager.activeViewCount()));
    }
}
