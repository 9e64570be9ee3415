package com.opsdash.realtimeservice.registry;

import com.opsdash.realtimeservice.feed.ChangeEvent;
import com.opsdash.realtimeservice.feed.ChannelHandle;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * An open feed channel shared by every handle of one scope with the same key.
 * The handle list doubles as the reference count.
 */
final class ManagedChannel {

    final Scope scope;
    final ChannelKey key;
    final List<SubscriptionHandle> handles = new CopyOnWriteArrayList<>();

    volatile ChannelHandle feedHandle;
    volatile CompletableFuture<Void> ready;

    ManagedChannel(Scope scope, ChannelKey key) {
        this.scope = scope;
        this.key = key;
    }

    void dispatch(ChangeEvent event) {
        for (SubscriptionHandle handle : handles) {
            handle.dispatch(event);
        }
    }

    void connectivityChanged(boolean connected) {
        for (SubscriptionHandle handle : handles) {
            handle.connectivityChanged(connected);
        }
    }
}
