package com.opsdash.realtimeservice.registry;

import java.util.HashMap;
import java.util.Map;

/**
 * Channels owned by one scope. All fields are guarded by the scope's monitor.
 */
final class Scope {

    final String id;
    final Map<ChannelKey, ManagedChannel> channels = new HashMap<>();
    boolean closed;

    Scope(String id) {
        this.id = id;
    }
}
