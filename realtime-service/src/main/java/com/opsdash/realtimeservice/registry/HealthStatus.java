package com.opsdash.realtimeservice.registry;

import lombok.Value;

@Value
public class HealthStatus {
    boolean connected;
    String error;

    public static HealthStatus up() {
        return new HealthStatus(true, null);
    }

    public static HealthStatus down(String error) {
        return new HealthStatus(false, error);
    }
}
