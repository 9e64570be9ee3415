package com.opsdash.realtimeservice.feed;

import java.util.function.Consumer;

/**
 * Boundary to the change-feed primitive of the row store.
 *
 * Implementations open one channel per call; deduplication is the registry's job.
 */
public interface ChangeFeedClient {

    /**
     * Opens a channel for changes on {@code table}, optionally narrowed by {@code filter}.
     * Confirmation arrives asynchronously through {@link ChannelHandle#live()}.
     *
     * @throws com.opsdash.common.exception.ConnectionException when the feed cannot be reached
     */
    ChannelHandle subscribe(String table, RowFilter filter, Consumer<ChangeEvent> onEvent);

    void unsubscribe(ChannelHandle handle);

    /**
     * Lightweight reachability probe.
     *
     * @throws com.opsdash.common.exception.ConnectionException when the feed is unreachable
     */
    void probe();

    static String channelName(String table, RowFilter filter) {
        String name = table + "_changes";
        return filter == null ? name : name + ":" + filter.toExpression();
    }
}
