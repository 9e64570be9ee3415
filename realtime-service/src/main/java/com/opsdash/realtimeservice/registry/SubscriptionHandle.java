package com.opsdash.realtimeservice.registry;

import com.opsdash.realtimeservice.feed.ChangeEvent;
import com.opsdash.realtimeservice.feed.RowFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One consumer's subscription to a topic.
 *
 * Several handles in a scope may share one underlying channel. A handle is live while its
 * generation is zero; unsubscribing bumps the generation, after which no new event is
 * dispatched to it. A dispatch that already passed the check runs to completion.
 */
@Slf4j
public final class SubscriptionHandle {

    private final String id = UUID.randomUUID().toString();
    private final String scopeId;
    private final ChannelKey key;
    private final ChangeListener listener;
    private final AtomicLong generation = new AtomicLong();

    // owning channel, set once under the scope lock
    ManagedChannel channel;

    SubscriptionHandle(String scopeId, ChannelKey key, ChangeListener listener) {
        this.scopeId = scopeId;
        this.key = key;
        this.listener = listener;
    }

    public String getId() {
        return id;
    }

    public String getScopeId() {
        return scopeId;
    }

    public String getTopic() {
        return key.getTopic();
    }

    public RowFilter getFilter() {
        return key.getFilter();
    }

    public ChannelKey getKey() {
        return key;
    }

    public long getGeneration() {
        return generation.get();
    }

    public boolean isLive() {
        return generation.get() == 0;
    }

    /**
     * Bumps the generation. Returns true only for the call that retired a live handle.
     */
    boolean tombstone() {
        return generation.getAndIncrement() == 0;
    }

    void dispatch(ChangeEvent event) {
        if (!isLive()) {
            return;
        }
        try {
            listener.onChange(event);
        } catch (RuntimeException e) {
            log.error("Change listener failed: handleId={}, scopeId={}, topic={}, eventType={}",
                    id, scopeId, key.getTopic(), event.getEventType(), e);
        }
    }

    void connectivityChanged(boolean connected) {
        if (!isLive()) {
            return;
        }
        try {
            listener.onConnectivityChange(key.channelName(), connected);
        } catch (RuntimeException e) {
            log.error("Connectivity listener failed: handleId={}, scopeId={}, channel={}",
                    id, scopeId, key.channelName(), e);
        }
    }

    @Override
    public String toString() {
        return "SubscriptionHandle[" + id + ", scope=" + scopeId + ", " + key.channelName()
                + ", generation=" + generation.get() + "]";
    }
}
