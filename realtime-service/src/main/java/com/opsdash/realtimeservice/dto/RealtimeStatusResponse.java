package com.opsdash.realtimeservice.dto;

import com.opsdash.realtimeservice.registry.RegistryStatus;
import lombok.Value;

@Value
public class RealtimeStatusResponse {
    RegistryStatus registry;
    int mountedViews;
}
