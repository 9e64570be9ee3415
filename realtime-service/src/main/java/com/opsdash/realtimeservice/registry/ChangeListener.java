package com.opsdash.realtimeservice.registry;

import com.opsdash.realtimeservice.feed.ChangeEvent;

/**
 * Consumer of change events for one subscription. Exceptions thrown here are logged
 * by the registry and never reach the change feed.
 */
@FunctionalInterface
public interface ChangeListener {

    void onChange(ChangeEvent event);

    /**
     * Called when the feed loses or regains the channel behind this subscription. Events
     * published while the channel was down are not replayed.
     */
    default void onConnectivityChange(String channelName, boolean connected) {
    }
}
