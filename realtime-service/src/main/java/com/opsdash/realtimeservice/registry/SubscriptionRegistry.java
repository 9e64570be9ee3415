package com.opsdash.realtimeservice.registry;

import com.opsdash.common.exception.ConnectionException;
import com.opsdash.common.exception.OpsDashException;
import com.opsdash.common.exception.SubscriptionTimeoutException;
import com.opsdash.common.exception.ValidationException;
import com.opsdash.common.result.Result;
import com.opsdash.realtimeservice.config.RealtimeProperties;
import com.opsdash.realtimeservice.feed.ChangeFeedClient;
import com.opsdash.realtimeservice.feed.ChannelHandle;
import com.opsdash.realtimeservice.feed.RowFilter;
import com.opsdash.realtimeservice.routing.RoleTopicRouter;
import com.opsdash.realtimeservice.routing.Topic;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Owns every open change-feed channel of the service.
 *
 * Subscriptions are grouped by scope (one per mounted dashboard view, plus a default scope).
 * Within a scope, subscribers of the same topic and filter share one reference-counted
 * channel. A channel must be confirmed live within the configured timeout; otherwise it is
 * closed again and every subscribe waiting on it fails with
 * {@link SubscriptionTimeoutException}. There is no automatic retry. Once live, losing and
 * regaining the channel is forwarded to every live handle's listener.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubscriptionRegistry {

    public static final String DEFAULT_SCOPE = "default";

    private final ChangeFeedClient changeFeedClient;
    private final RoleTopicRouter roleTopicRouter;
    private final RealtimeProperties properties;

    private final ConcurrentHashMap<String, Scope> scopes = new ConcurrentHashMap<>();

    public CompletableFuture<Result<SubscriptionHandle>> subscribe(String topic, ChangeListener listener,
                                                                   RowFilter filter) {
        return subscribe(DEFAULT_SCOPE, topic, filter, listener);
    }

    public CompletableFuture<Result<SubscriptionHandle>> subscribe(String scopeId, String topic, RowFilter filter,
                                                                   ChangeListener listener) {
        if (scopeId == null || scopeId.isBlank()) {
            return failed(new ValidationException("scopeId", "Scope id is required"));
        }
        if (topic == null || topic.isBlank()) {
            return failed(new ValidationException("topic", "Topic is required"));
        }
        if (listener == null) {
            return failed(new ValidationException("listener", "Listener is required"));
        }

        ChannelKey key = ChannelKey.of(topic, filter);
        SubscriptionHandle handle = new SubscriptionHandle(scopeId, key, listener);
        ManagedChannel channel;
        try {
            channel = attach(scopeId, key, handle);
        } catch (ConnectionException e) {
            log.warn("Subscribe failed: scopeId={}, channel={}, error={}", scopeId, key.channelName(), e.getMessage());
            return failed(e);
        }

        return channel.ready.handle((ignored, ex) -> {
            if (ex == null) {
                log.debug("Subscribed: handleId={}, scopeId={}, channel={}", handle.getId(), scopeId, key.channelName());
                return Result.ok(handle);
            }
            handle.tombstone();
            return Result.<SubscriptionHandle>failure(toError(ex, key));
        });
    }

    public CompletableFuture<SubscriptionSet> subscribeScoped(String scopeId, Collection<String> topics,
                                                              ChangeListener listener) {
        List<ChannelKey> keys = topics.stream()
                .map(ChannelKey::of)
                .collect(Collectors.toList());
        return subscribeKeys(scopeId, keys, listener);
    }

    public CompletableFuture<SubscriptionSet> subscribeKeys(String scopeId, Collection<ChannelKey> keys,
                                                            ChangeListener listener) {
        Map<ChannelKey, CompletableFuture<Result<SubscriptionHandle>>> pending = new LinkedHashMap<>();
        for (ChannelKey key : keys) {
            pending.putIfAbsent(key, subscribe(scopeId, key.getTopic(), key.getFilter(), listener));
        }

        return CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<SubscriptionHandle> handles = new ArrayList<>();
                    Map<String, OpsDashException> failures = new LinkedHashMap<>();
                    pending.forEach((key, future) -> {
                        Result<SubscriptionHandle> result = future.join();
                        if (result.isOk()) {
                            handles.add(result.getData());
                        } else {
                            failures.put(key.channelName(), result.getError());
                        }
                    });
                    if (!failures.isEmpty()) {
                        log.warn("Scope subscribed with failures: scopeId={}, live={}, failed={}",
                                scopeId, handles.size(), failures.keySet());
                    } else {
                        log.info("Scope subscribed: scopeId={}, channels={}", scopeId, handles.size());
                    }
                    return new SubscriptionSet(scopeId, Collections.unmodifiableList(handles),
                            Collections.unmodifiableMap(failures));
                });
    }

    /**
     * Subscribes {@code scopeId} to every topic of {@code role}. An unknown role yields an
     * empty set.
     */
    public CompletableFuture<SubscriptionSet> subscribeToRoleScope(String scopeId, String role,
                                                                   ChangeListener listener) {
        return subscribeScoped(scopeId, roleTopicRouter.tablesForRole(role), listener);
    }

    /**
     * Subscribes {@code scopeId} to the rows owned by one user: their notifications, the
     * workflows they started and the approvals they requested.
     */
    public CompletableFuture<SubscriptionSet> subscribeToUserScope(String scopeId, String userId,
                                                                   ChangeListener listener) {
        if (userId == null || userId.isBlank()) {
            return CompletableFuture.completedFuture(new SubscriptionSet(scopeId, List.of(),
                    Map.of("user", new ValidationException("userId", "User id is required"))));
        }
        List<ChannelKey> keys = List.of(
                ChannelKey.of(Topic.NOTIFICATIONS.getTable(), RowFilter.eq("recipient_id", userId)),
                ChannelKey.of(Topic.WORKFLOW_INSTANCES.getTable(), RowFilter.eq("initiated_by", userId)),
                ChannelKey.of(Topic.APPROVAL_REQUESTS.getTable(), RowFilter.eq("requested_by", userId)));
        return subscribeKeys(scopeId, keys, listener);
    }

    /**
     * Retires {@code handle} and releases its channel reference; the channel closes with the
     * last reference. Returns false when the handle was already retired.
     */
    public boolean unsubscribe(SubscriptionHandle handle) {
        if (handle == null || !handle.tombstone()) {
            return false;
        }
        ManagedChannel channel = handle.channel;
        if (channel == null) {
            return true;
        }

        Scope scope = channel.scope;
        boolean lastReference;
        synchronized (scope) {
            channel.handles.remove(handle);
            lastReference = channel.handles.isEmpty() && scope.channels.remove(channel.key, channel);
            if (scope.channels.isEmpty()) {
                scope.closed = true;
                scopes.remove(scope.id, scope);
            }
        }

        if (lastReference) {
            closeQuietly(channel);
        }
        log.debug("Unsubscribed: handleId={}, scopeId={}, channelClosed={}", handle.getId(), scope.id, lastReference);
        return true;
    }

    /**
     * Tears down every subscription of {@code scopeId}. Safe to call repeatedly.
     *
     * @return number of handles retired by this call
     */
    public int unsubscribeAll(String scopeId) {
        Scope scope = scopeId != null ? scopes.remove(scopeId) : null;
        if (scope == null) {
            return 0;
        }

        List<ManagedChannel> channels;
        synchronized (scope) {
            scope.closed = true;
            channels = new ArrayList<>(scope.channels.values());
            scope.channels.clear();
        }

        int retired = 0;
        for (ManagedChannel channel : channels) {
            for (SubscriptionHandle handle : channel.handles) {
                if (handle.tombstone()) {
                    retired++;
                }
            }
            channel.handles.clear();
            closeQuietly(channel);
        }

        log.info("Scope torn down: scopeId={}, channels={}, handles={}", scopeId, channels.size(), retired);
        return retired;
    }

    public HealthStatus healthCheck() {
        try {
            changeFeedClient.probe();
            return HealthStatus.up();
        } catch (ConnectionException e) {
            log.warn("Change feed health check failed: {}", e.getMessage());
            return HealthStatus.down(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Change feed health check failed unexpectedly", e);
            return HealthStatus.down(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    public RegistryStatus getStatus() {
        List<String> channelNames = new ArrayList<>();
        int handleCount = 0;
        for (Scope scope : scopes.values()) {
            synchronized (scope) {
                for (ManagedChannel channel : scope.channels.values()) {
                    channelNames.add(channel.key.channelName());
                    handleCount += channel.handles.size();
                }
            }
        }
        Collections.sort(channelNames);
        return new RegistryStatus(scopes.size(), channelNames.size(), handleCount,
                Collections.unmodifiableList(channelNames));
    }

    public int liveHandleCount(String scopeId) {
        Scope scope = scopes.get(scopeId);
        if (scope == null) {
            return 0;
        }
        synchronized (scope) {
            return scope.channels.values().stream()
                    .mapToInt(channel -> (int) channel.handles.stream().filter(SubscriptionHandle::isLive).count())
                    .sum();
        }
    }

    public int liveChannelCount(String scopeId) {
        Scope scope = scopes.get(scopeId);
        if (scope == null) {
            return 0;
        }
        synchronized (scope) {
            return scope.channels.size();
        }
    }

    private ManagedChannel attach(String scopeId, ChannelKey key, SubscriptionHandle handle) {
        while (true) {
            Scope scope = scopes.computeIfAbsent(scopeId, Scope::new);
            synchronized (scope) {
                // lost a race with unsubscribeAll; the next computeIfAbsent creates a fresh scope
                if (scope.closed) {
                    continue;
                }
                ManagedChannel channel = scope.channels.get(key);
                if (channel == null) {
                    try {
                        channel = open(scope, key);
                    } catch (ConnectionException e) {
                        if (scope.channels.isEmpty()) {
                            scope.closed = true;
                            scopes.remove(scope.id, scope);
                        }
                        throw e;
                    }
                }
                handle.channel = channel;
                channel.handles.add(handle);
                return channel;
            }
        }
    }

    private ManagedChannel open(Scope scope, ChannelKey key) {
        ManagedChannel channel = new ManagedChannel(scope, key);
        ChannelHandle feedHandle = changeFeedClient.subscribe(key.getTopic(), key.getFilter(), channel::dispatch);
        channel.feedHandle = feedHandle;
        scope.channels.put(key, channel);
        log.debug("Channel opening: scopeId={}, channel={}", scope.id, key.channelName());
        // subscribers complete only after a failed channel has been removed
        channel.ready = feedHandle.live()
                .orTimeout(confirmTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, ex) -> {
                    if (ex != null) {
                        fail(channel, ex);
                    } else {
                        feedHandle.onConnectivityChange(connected -> onConnectivityChange(channel, connected));
                    }
                });
        return channel;
    }

    private void fail(ManagedChannel channel, Throwable cause) {
        Scope scope = channel.scope;
        List<SubscriptionHandle> orphaned;
        synchronized (scope) {
            scope.channels.remove(channel.key, channel);
            orphaned = new ArrayList<>(channel.handles);
            channel.handles.clear();
            if (scope.channels.isEmpty()) {
                scope.closed = true;
                scopes.remove(scope.id, scope);
            }
        }
        orphaned.forEach(SubscriptionHandle::tombstone);
        closeQuietly(channel);

        OpsDashException error = toError(cause, channel.key);
        log.warn("Channel failed: scopeId={}, channel={}, handles={}, error={}",
                scope.id, channel.key.channelName(), orphaned.size(), error.getMessage());
    }

    private void onConnectivityChange(ManagedChannel channel, boolean connected) {
        if (connected) {
            log.info("Channel restored: scopeId={}, channel={}", channel.scope.id, channel.key.channelName());
        } else {
            log.warn("Channel disconnected: scopeId={}, channel={}, handles={}",
                    channel.scope.id, channel.key.channelName(), channel.handles.size());
        }
        channel.connectivityChanged(connected);
    }

    private void closeQuietly(ManagedChannel channel) {
        try {
            changeFeedClient.unsubscribe(channel.feedHandle);
        } catch (RuntimeException e) {
            log.warn("Error closing channel {}: {}", channel.key.channelName(), e.getMessage());
        }
    }

    private OpsDashException toError(Throwable ex, ChannelKey key) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return new SubscriptionTimeoutException(key.channelName(), confirmTimeout());
        }
        if (cause instanceof OpsDashException opsDashException) {
            return opsDashException;
        }
        return new ConnectionException("Channel " + key.channelName() + " failed: " + cause.getMessage(), cause);
    }

    private Duration confirmTimeout() {
        return properties.getConfirmTimeout();
    }

    private static <T> CompletableFuture<Result<T>> failed(OpsDashException error) {
        return CompletableFuture.completedFuture(Result.failure(error));
    }
}
