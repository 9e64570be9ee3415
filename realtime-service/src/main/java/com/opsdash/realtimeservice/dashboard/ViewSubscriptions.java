package com.opsdash.realtimeservice.dashboard;

import com.opsdash.realtimeservice.registry.ChangeListener;
import com.opsdash.realtimeservice.registry.SubscriptionSet;

import java.util.concurrent.CompletableFuture;

/**
 * Opens and closes the change subscriptions of one view, all under one scope.
 */
public interface ViewSubscriptions {

    CompletableFuture<SubscriptionSet> open(String scopeId, ChangeListener listener);

    void close(String scopeId);
}
