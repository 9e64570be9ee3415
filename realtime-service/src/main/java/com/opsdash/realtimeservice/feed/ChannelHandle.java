package com.opsdash.realtimeservice.feed;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * One open channel on the change feed.
 */
public interface ChannelHandle {

    String getName();

    String getTable();

    RowFilter getFilter();

    /**
     * Completes when the feed confirms the channel is live, or exceptionally when it
     * refuses it. No latency bound is implied.
     */
    CompletableFuture<Void> live();

    /**
     * Registers a callback for losing ({@code false}) and regaining ({@code true}) the
     * channel after it went live. Feeds without such signals never call it.
     */
    default void onConnectivityChange(Consumer<Boolean> listener) {
    }
}
