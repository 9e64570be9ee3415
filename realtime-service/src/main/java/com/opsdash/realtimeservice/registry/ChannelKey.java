package com.opsdash.realtimeservice.registry;

import com.opsdash.realtimeservice.feed.ChangeFeedClient;
import com.opsdash.realtimeservice.feed.RowFilter;
import lombok.NonNull;
import lombok.Value;

/**
 * Identity of an underlying channel within a scope: at most one per key.
 */
@Value
public class ChannelKey {
    @NonNull String topic;
    RowFilter filter;

    public static ChannelKey of(String topic) {
        return new ChannelKey(topic, null);
    }

    public static ChannelKey of(String topic, RowFilter filter) {
        return new ChannelKey(topic, filter);
    }

    public String channelName() {
        return ChangeFeedClient.channelName(topic, filter);
    }
}
