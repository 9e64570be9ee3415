package com.opsdash.realtimeservice.dashboard;

import com.opsdash.common.exception.ValidationException;
import com.opsdash.common.result.Result;
import com.opsdash.realtimeservice.config.RealtimeProperties;
import com.opsdash.realtimeservice.feed.RowFilter;
import com.opsdash.realtimeservice.registry.ChangeListener;
import com.opsdash.realtimeservice.registry.ChannelKey;
import com.opsdash.realtimeservice.registry.SubscriptionRegistry;
import com.opsdash.realtimeservice.registry.SubscriptionSet;
import com.opsdash.realtimeservice.routing.Topic;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mounted dashboard views, keyed by WebSocket session and view id.
 *
 * Mounting a view id that is already mounted in the session replaces the old view. Every
 * view gets its own subscription scope, named session/view/sequence. The views of a session
 * are only changed inside {@code compute} calls on the session entry, and a view that left
 * the map is released, so it can no longer be mounted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DashboardViewManager {

    private final SubscriptionRegistry subscriptionRegistry;
    private final RoleSnapshotLoader roleSnapshotLoader;
    private final InboxSnapshotLoader inboxSnapshotLoader;
    private final DashboardPublisher dashboardPublisher;
    private final ThreadPoolTaskScheduler dashboardScheduler;
    private final RealtimeProperties properties;

    private final Map<String, Map<String, DashboardView>> viewsBySession = new ConcurrentHashMap<>();
    // keeps scopes of a replaced view apart from its successor's
    private final AtomicLong viewSequence = new AtomicLong();

    public Result<DashboardView> mount(String sessionId, String userId, String role, String viewId,
                                       DashboardViewKind kind) {
        if (sessionId == null || sessionId.isBlank()) {
            return Result.failure(new ValidationException("sessionId", "Session id is required"));
        }
        if (userId == null || userId.isBlank()) {
            return Result.failure(new ValidationException("userId", "User id is required"));
        }
        if (viewId == null || viewId.isBlank()) {
            return Result.failure(new ValidationException("viewId", "View id is required"));
        }

        DashboardViewKind resolvedKind = kind != null ? kind : DashboardViewKind.ROLE_DASHBOARD;
        DashboardView view = createView(sessionId, userId, role, viewId, resolvedKind);

        AtomicReference<DashboardView> previous = new AtomicReference<>();
        viewsBySession.compute(sessionId, (id, views) -> {
            Map<String, DashboardView> sessionViews = views != null ? views : new ConcurrentHashMap<>();
            previous.set(sessionViews.put(viewId, view));
            return sessionViews;
        });
        if (previous.get() != null) {
            log.info("Replacing mounted view: sessionId={}, viewId={}", sessionId, viewId);
            previous.get().release();
        }

        // refused when a concurrent unmount already released the view
        if (!view.mount()) {
            log.debug("View released before mounting: sessionId={}, viewId={}", sessionId, viewId);
        }
        return Result.ok(view);
    }

    public boolean unmount(String sessionId, String viewId) {
        if (sessionId == null || viewId == null) {
            return false;
        }
        AtomicReference<DashboardView> removed = new AtomicReference<>();
        viewsBySession.computeIfPresent(sessionId, (id, views) -> {
            removed.set(views.remove(viewId));
            return views.isEmpty() ? null : views;
        });
        DashboardView view = removed.get();
        return view != null && view.release();
    }

    /**
     * Unmounts every view of a session.
     *
     * @return number of views released
     */
    public int unmountSession(String sessionId) {
        Map<String, DashboardView> views = sessionId != null ? viewsBySession.remove(sessionId) : null;
        if (views == null) {
            return 0;
        }
        int released = 0;
        for (DashboardView view : views.values()) {
            if (view.release()) {
                released++;
            }
        }
        return released;
    }

    public int activeViewCount() {
        return viewsBySession.values().stream().mapToInt(Map::size).sum();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Unmounting {} dashboard view(s)", activeViewCount());
        List.copyOf(viewsBySession.keySet()).forEach(this::unmountSession);
    }

    private DashboardView createView(String sessionId, String userId, String role, String viewId,
                                     DashboardViewKind kind) {
        SnapshotLoader loader;
        ViewSubscriptions subscriptions;
        if (kind == DashboardViewKind.NOTIFICATION_INBOX) {
            loader = inboxSnapshotLoader.forRecipient(userId);
            subscriptions = registryBacked((scopeId, listener) -> subscriptionRegistry.subscribeKeys(scopeId,
                    List.of(ChannelKey.of(Topic.NOTIFICATIONS.getTable(), RowFilter.eq("recipient_id", userId))),
                    listener));
        } else {
            loader = roleSnapshotLoader.forRole(role);
            subscriptions = registryBacked((scopeId, listener) ->
                    subscriptionRegistry.subscribeToRoleScope(scopeId, role, listener));
        }

        String baseScopeId = sessionId + "/" + viewId + "/" + viewSequence.incrementAndGet();
        return new DashboardView(viewId, baseScopeId, userId, kind, loader, subscriptions,
                dashboardPublisher, dashboardScheduler, properties.getReloadDebounce());
    }

    private ViewSubscriptions registryBacked(Opener opener) {
        return new ViewSubscriptions() {
            @Override
            public CompletableFuture<SubscriptionSet> open(String scopeId, ChangeListener listener) {
                return opener.open(scopeId, listener);
            }

            @Override
            public void close(String scopeId) {
                subscriptionRegistry.unsubscribeAll(scopeId);
            }
        };
    }

    @FunctionalInterface
    private interface Opener {
        CompletableFuture<SubscriptionSet> open(String scopeId, ChangeListener listener);
    }
}
