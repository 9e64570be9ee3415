package com.opsdash.realtimeservice.registry;

import lombok.Value;

import java.util.List;

/**
 * Snapshot of what the registry holds open.
 */
@Value
public class RegistryStatus {
    int scopeCount;
    int channelCount;
    int handleCount;
    List<String> channels;
}
