package com.opsdash.realtimeservice.dashboard;

import com.opsdash.realtimeservice.dto.DashboardSnapshot;
import com.opsdash.realtimeservice.dto.DashboardStatus;
import com.opsdash.realtimeservice.feed.ChangeEvent;
import com.opsdash.realtimeservice.registry.ChangeListener;
import com.opsdash.realtimeservice.registry.SubscriptionSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * One mounted dashboard: initial snapshot, change subscriptions, coalesced reloads, teardown.
 *
 * Change events never patch the rendered state. The first event after a quiet period
 * triggers a full reload right away; further events before it starts are absorbed, and
 * events that arrive while a reload is loading queue exactly one trailing reload. A reload
 * never starts sooner than the debounce window after the previous one. Each mount gets its
 * own subscription scope, so results of a mount that was torn down in the meantime can be
 * recognised and dropped.
 *
 * Losing a channel publishes a disconnected status and keeps the last snapshot; once every
 * lost channel is back the view reports connected again and reloads, since events published
 * in between are not replayed.
 *
 * State is guarded by a private lock. The snapshot loader is always called without it.
 */
@Slf4j
public class DashboardView {

    static final String CONNECTION_LOST = "Real-time connection lost";
    static final String CHANNELS_FAILED = "Some channels could not be subscribed";

    private final String viewId;
    private final String baseScopeId;
    private final String userId;
    private final DashboardViewKind kind;
    private final SnapshotLoader loader;
    private final ViewSubscriptions subscriptions;
    private final DashboardPublisher publisher;
    private final ThreadPoolTaskScheduler scheduler;
    private final Duration debounce;
    private final ChangeListener listener = new ChangeListener() {
        @Override
        public void onChange(ChangeEvent event) {
            DashboardView.this.onChange(event);
        }

        @Override
        public void onConnectivityChange(String channelName, boolean connected) {
            DashboardView.this.onConnectivityChange(channelName, connected);
        }
    };

    private final Object lock = new Object();
    private DashboardState state = DashboardState.IDLE;
    private boolean released;
    private long mountGeneration;
    private String scopeId;
    private ScheduledFuture<?> pendingReload;
    private boolean trailingReload;
    private Instant lastReloadStarted;
    private long version;
    private String subscribeError;
    private List<String> failedChannels = List.of();
    private final Set<String> lostChannels = new LinkedHashSet<>();

    public DashboardView(String viewId, String baseScopeId, String userId, DashboardViewKind kind,
                         SnapshotLoader loader, ViewSubscriptions subscriptions, DashboardPublisher publisher,
                         ThreadPoolTaskScheduler scheduler, Duration debounce) {
        this.viewId = viewId;
        this.baseScopeId = baseScopeId;
        this.userId = userId;
        this.kind = kind;
        this.loader = loader;
        this.subscriptions = subscriptions;
        this.publisher = publisher;
        this.scheduler = scheduler;
        this.debounce = debounce;
    }

    /**
     * Starts loading. The snapshot is fetched on the scheduler, then the view subscribes.
     *
     * @return false when the view is already mounted or has been released
     */
    public boolean mount() {
        long generation;
        synchronized (lock) {
            if (released) {
                log.debug("Mount ignored, view released: viewId={}", viewId);
                return false;
            }
            if (state != DashboardState.IDLE) {
                log.warn("Mount ignored, view not idle: viewId={}, state={}", viewId, state);
                return false;
            }
            generation = ++mountGeneration;
            scopeId = baseScopeId + "#" + generation;
            state = DashboardState.LOADING;
            trailingReload = false;
            lastReloadStarted = null;
            version = 0;
            subscribeError = null;
            failedChannels = List.of();
            lostChannels.clear();
        }
        log.info("Mounting view: viewId={}, kind={}, userId={}", viewId, kind, userId);
        scheduler.execute(() -> initialLoad(generation));
        return true;
    }

    /**
     * Cancels a pending reload, releases every subscription and drops the result of any
     * in-flight load. The view can be mounted again afterwards.
     *
     * @return false when the view was not mounted
     */
    public boolean unmount() {
        String releasedScope;
        synchronized (lock) {
            if (state == DashboardState.IDLE || state == DashboardState.UNSUBSCRIBING) {
                return false;
            }
            state = DashboardState.UNSUBSCRIBING;
            mountGeneration++;
            if (pendingReload != null) {
                pendingReload.cancel(false);
                pendingReload = null;
            }
            trailingReload = false;
            releasedScope = scopeId;
        }

        try {
            subscriptions.close(releasedScope);
        } finally {
            synchronized (lock) {
                state = DashboardState.IDLE;
            }
        }
        log.info("View unmounted: viewId={}, scopeId={}", viewId, releasedScope);
        return true;
    }

    /**
     * Unmounts the view for good. A later {@link #mount()} is refused, also when this view
     * was never mounted.
     *
     * @return false when the view was not mounted
     */
    public boolean release() {
        synchronized (lock) {
            released = true;
        }
        return unmount();
    }

    void onChange(ChangeEvent event) {
        synchronized (lock) {
            requestReloadLocked();
        }
        log.debug("Change received: viewId={}, topic={}, eventType={}", viewId, event.getTopic(), event.getEventType());
    }

    void onConnectivityChange(String channelName, boolean channelConnected) {
        synchronized (lock) {
            if (state == DashboardState.IDLE || state == DashboardState.UNSUBSCRIBING) {
                return;
            }
            if (!channelConnected) {
                if (lostChannels.add(channelName) && state != DashboardState.LOADING) {
                    publishStatusLocked(false, CONNECTION_LOST, degradedChannelsLocked());
                }
                return;
            }
            if (!lostChannels.remove(channelName) || !lostChannels.isEmpty()) {
                return;
            }
            if (state != DashboardState.LOADING) {
                publishSubscriptionStatusLocked();
            }
            requestReloadLocked();
        }
    }

    public DashboardState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public String getViewId() {
        return viewId;
    }

    public String getUserId() {
        return userId;
    }

    public DashboardViewKind getKind() {
        return kind;
    }

    public String getScopeId() {
        synchronized (lock) {
            return scopeId;
        }
    }

    private void initialLoad(long generation) {
        DashboardSnapshot snapshot = loadQuietly();

        String scope;
        synchronized (lock) {
            if (generation != mountGeneration) {
                return;
            }
            if (snapshot != null) {
                publishSnapshotLocked(snapshot);
            } else {
                publishStatusLocked(false, "Initial load failed", List.of());
            }
            scope = scopeId;
        }

        CompletableFuture<SubscriptionSet> opened;
        try {
            opened = subscriptions.open(scope, listener);
        } catch (RuntimeException e) {
            log.error("Opening subscriptions failed: viewId={}, scopeId={}", viewId, scope, e);
            opened = CompletableFuture.failedFuture(e);
        }
        opened.whenComplete((set, ex) -> onSubscribed(generation, scope, set, ex));
    }

    private void onSubscribed(long generation, String scope, SubscriptionSet set, Throwable ex) {
        synchronized (lock) {
            if (generation == mountGeneration) {
                state = DashboardState.SUBSCRIBED;
                if (ex != null) {
                    subscribeError = ex.getMessage();
                } else if (set.isDegraded()) {
                    failedChannels = List.copyOf(set.getFailures().keySet());
                }
                publishSubscriptionStatusLocked();
                if (trailingReload) {
                    trailingReload = false;
                    scheduleReloadLocked();
                }
                return;
            }
        }
        // unmounted while subscribing: the scope may have gained channels after it was closed
        log.debug("Releasing subscriptions of a stale mount: viewId={}, scopeId={}", viewId, scope);
        subscriptions.close(scope);
    }

    private void requestReloadLocked() {
        switch (state) {
            case LOADING, RELOADING -> trailingReload = true;
            case SUBSCRIBED -> scheduleReloadLocked();
            case RELOAD_PENDING, IDLE, UNSUBSCRIBING -> {
                // absorbed by the pending reload, or the view is gone
            }
        }
    }

    private void scheduleReloadLocked() {
        state = DashboardState.RELOAD_PENDING;
        long generation = mountGeneration;
        Instant now = Instant.now();
        Instant due = now;
        if (lastReloadStarted != null && lastReloadStarted.plus(debounce).isAfter(now)) {
            due = lastReloadStarted.plus(debounce);
        }
        pendingReload = scheduler.schedule(() -> reload(generation), due);
    }

    private void reload(long generation) {
        synchronized (lock) {
            if (generation != mountGeneration || state != DashboardState.RELOAD_PENDING) {
                return;
            }
            state = DashboardState.RELOADING;
            pendingReload = null;
            lastReloadStarted = Instant.now();
        }

        DashboardSnapshot snapshot = loadQuietly();

        synchronized (lock) {
            if (generation != mountGeneration) {
                log.debug("Discarding reload of an unmounted view: viewId={}", viewId);
                return;
            }
            if (snapshot != null) {
                publishSnapshotLocked(snapshot);
            }
            if (trailingReload) {
                trailingReload = false;
                scheduleReloadLocked();
            } else {
                state = DashboardState.SUBSCRIBED;
            }
        }
    }

    private DashboardSnapshot loadQuietly() {
        try {
            return loader.load();
        } catch (RuntimeException e) {
            log.error("Snapshot load failed: viewId={}, kind={}", viewId, kind, e);
            return null;
        }
    }

    private List<String> degradedChannelsLocked() {
        List<String> degraded = new ArrayList<>(failedChannels);
        degraded.addAll(lostChannels);
        return degraded;
    }

    private void publishSubscriptionStatusLocked() {
        if (!lostChannels.isEmpty()) {
            publishStatusLocked(false, CONNECTION_LOST, degradedChannelsLocked());
        } else if (subscribeError != null) {
            publishStatusLocked(false, subscribeError, List.of());
        } else if (!failedChannels.isEmpty()) {
            publishStatusLocked(false, CHANNELS_FAILED, failedChannels);
        } else {
            publishStatusLocked(true, null, List.of());
        }
    }

    private void publishSnapshotLocked(DashboardSnapshot snapshot) {
        DashboardSnapshot stamped = snapshot.toBuilder()
                .viewId(viewId)
                .kind(kind)
                .version(++version)
                .loadedAt(Instant.now())
                .build();
        try {
            publisher.publishSnapshot(userId, stamped);
        } catch (RuntimeException e) {
            log.warn("Snapshot delivery failed: viewId={}, userId={}, error={}", viewId, userId, e.getMessage());
        }
    }

    private void publishStatusLocked(boolean nowConnected, String error, List<String> channels) {
        DashboardStatus status = DashboardStatus.builder()
                .viewId(viewId)
                .state(state)
                .connected(nowConnected)
                .error(error)
                .failedChannels(channels)
                .timestamp(Instant.now())
                .build();
        try {
            publisher.publishStatus(userId, status);
        } catch (RuntimeException e) {
            log.warn("Status delivery failed: viewId={}, userId={}, error={}", viewId, userId, e.getMessage());
        }
    }
}
