package com.opsdash.realtimeservice.dashboard;

import com.opsdash.common.exception.ConnectionException;
import com.opsdash.realtimeservice.dto.DashboardSnapshot;
import com.opsdash.realtimeservice.dto.DashboardStatus;
import com.opsdash.realtimeservice.feed.ChangeEvent;
import com.opsdash.realtimeservice.feed.ChangeEventType;
import com.opsdash.realtimeservice.feed.RowRecord;
import com.opsdash.realtimeservice.registry.ChangeListener;
import com.opsdash.realtimeservice.registry.SubscriptionSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DashboardView.
 * The scheduler runs the initial load inline and holds reloads until the test runs them.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DashboardViewTest {

    private static final String BASE_SCOPE = "session-1/inventory";

    @Mock
    private ThreadPoolTaskScheduler scheduler;
    @Mock
    private ScheduledFuture<Object> pendingFuture;
    @Mock
    private DashboardPublisher publisher;

    private final List<Runnable> delayed = new ArrayList<>();
    private final List<Instant> dueTimes = new ArrayList<>();
    private final AtomicInteger loads = new AtomicInteger();
    private final StubSubscriptions subscriptions = new StubSubscriptions();

    // runs inside the loader, before the snapshot is returned; receives the load number
    private IntConsumer duringLoad = load -> { };
    private boolean failLoads;

    private DashboardView view;

    @BeforeEach
    void setUp() {
        doAnswer(i -> {
            ((Runnable) i.getArgument(0)).run();
            return null;
        }).when(scheduler).execute(any(Runnable.class));

        doAnswer(i -> {
            delayed.add(i.getArgument(0));
            dueTimes.add(i.getArgument(1));
            return pendingFuture;
        }).when(scheduler).schedule(any(Runnable.class), any(Instant.class));

        SnapshotLoader loader = () -> {
            int load = loads.incrementAndGet();
            duringLoad.accept(load);
            if (failLoads) {
                throw new IllegalStateException("database unavailable");
            }
            return DashboardSnapshot.builder()
                    .tables(Map.of("inventory_items", List.of(Map.of("id", "item-" + load))))
                    .build();
        };

        view = new DashboardView("inventory", BASE_SCOPE, "user-1", DashboardViewKind.ROLE_DASHBOARD,
                loader, subscriptions, publisher, scheduler, Duration.ofMillis(250));
    }

    private static ChangeEvent inventoryInsert(String id) {
        return ChangeEvent.of("inventory_items", ChangeEventType.INSERT,
                RowRecord.of(Map.of("id", id)), null, Instant.now());
    }

    private List<DashboardSnapshot> publishedSnapshots() {
        ArgumentCaptor<DashboardSnapshot> captor = ArgumentCaptor.forClass(DashboardSnapshot.class);
        verify(publisher, atLeast(0)).publishSnapshot(eq("user-1"), captor.capture());
        return captor.getAllValues();
    }

    private List<DashboardStatus> publishedStatuses() {
        ArgumentCaptor<DashboardStatus> captor = ArgumentCaptor.forClass(DashboardStatus.class);
        verify(publisher, atLeast(0)).publishStatus(eq("user-1"), captor.capture());
        return captor.getAllValues();
    }

    private void runDelayed(int index) {
        delayed.get(index).run();
    }

    @Nested
    @DisplayName("mount")
    class Mount {

        @Test
        void mount_LoadsSnapshotThenSubscribes() {
            // Act
            boolean mounted = view.mount();

            // Assert
            assertThat(mounted).isTrue();
            assertThat(view.getState()).isEqualTo(DashboardState.SUBSCRIBED);
            assertThat(view.getScopeId()).isEqualTo(BASE_SCOPE + "#1");
            assertThat(subscriptions.opened).containsExactly(BASE_SCOPE + "#1");

            List<DashboardSnapshot> snapshots = publishedSnapshots();
            assertThat(snapshots).hasSize(1);
            assertThat(snapshots.get(0).getVersion()).isEqualTo(1);
            assertThat(snapshots.get(0).getViewId()).isEqualTo("inventory");
            assertThat(snapshots.get(0).getKind()).isEqualTo(DashboardViewKind.ROLE_DASHBOARD);
            assertThat(snapshots.get(0).getLoadedAt()).isNotNull();

            List<DashboardStatus> statuses = publishedStatuses();
            assertThat(statuses).hasSize(1);
            assertThat(statuses.get(0).isConnected()).isTrue();
            assertThat(statuses.get(0).getState()).isEqualTo(DashboardState.SUBSCRIBED);
        }

        @Test
        void mount_AlreadyMounted_IsIgnored() {
            // Arrange
            view.mount();

            // Act
            boolean second = view.mount();

            // Assert
            assertThat(second).isFalse();
            assertThat(loads.get()).isEqualTo(1);
        }

        @Test
        void mount_InitialLoadFails_ReportsErrorAndStillSubscribes() {
            // Arrange
            failLoads = true;

            // Act
            view.mount();

            // Assert
            assertThat(publishedSnapshots()).isEmpty();
            List<DashboardStatus> statuses = publishedStatuses();
            assertThat(statuses.get(0).isConnected()).isFalse();
            assertThat(statuses.get(0).getError()).isEqualTo("Initial load failed");
            assertThat(view.getState()).isEqualTo(DashboardState.SUBSCRIBED);
        }

        @Test
        void mount_SomeChannelsFailed_ReportsDegradedStatus() {
            // Arrange
            subscriptions.nextResult = CompletableFuture.completedFuture(new SubscriptionSet(BASE_SCOPE + "#1",
                    List.of(), Map.of("deliveries_changes", new ConnectionException("Channel refused"))));

            // Act
            view.mount();

            // Assert
            DashboardStatus status = publishedStatuses().get(0);
            assertThat(status.isConnected()).isFalse();
            assertThat(status.getFailedChannels()).containsExactly("deliveries_changes");
            assertThat(view.getState()).isEqualTo(DashboardState.SUBSCRIBED);
        }

        @Test
        void changeDuringInitialLoad_SchedulesReloadOnceSubscribed() {
            // Arrange
            duringLoad = load -> {
                if (load == 1) {
                    view.onChange(inventoryInsert("item-9"));
                }
            };

            // Act
            view.mount();

            // Assert
            assertThat(view.getState()).isEqualTo(DashboardState.RELOAD_PENDING);
            assertThat(delayed).hasSize(1);
        }
    }

    @Nested
    @DisplayName("reload coalescing")
    class Coalescing {

        @Test
        void burstOfInventoryChanges_TriggersExactlyOneImmediateReload() {
            // Arrange
            view.mount();

            // Act
            for (int i = 0; i < 5; i++) {
                subscriptions.listener.onChange(inventoryInsert("item-" + i));
            }

            // Assert
            assertThat(delayed).hasSize(1);
            assertThat(view.getState()).isEqualTo(DashboardState.RELOAD_PENDING);
            verify(scheduler).schedule(any(Runnable.class), any(Instant.class));
            assertThat(dueTimes.get(0)).isBeforeOrEqualTo(Instant.now());

            runDelayed(0);

            assertThat(loads.get()).isEqualTo(2);
            assertThat(view.getState()).isEqualTo(DashboardState.SUBSCRIBED);
            List<DashboardSnapshot> snapshots = publishedSnapshots();
            assertThat(snapshots).hasSize(2);
            assertThat(snapshots.get(1).getVersion()).isEqualTo(2);
        }

        @Test
        void changesDuringReload_QueueOneTrailingReloadAfterDebounce() {
            // Arrange
            duringLoad = load -> {
                if (load == 2) {
                    subscriptions.listener.onChange(inventoryInsert("late-1"));
                    subscriptions.listener.onChange(inventoryInsert("late-2"));
                }
            };
            view.mount();
            subscriptions.listener.onChange(inventoryInsert("item-1"));
            Instant beforeReload = Instant.now();

            // Act
            runDelayed(0);

            // Assert
            assertThat(delayed).hasSize(2);
            assertThat(view.getState()).isEqualTo(DashboardState.RELOAD_PENDING);
            assertThat(dueTimes.get(1)).isAfterOrEqualTo(beforeReload.plusMillis(250));

            runDelayed(1);

            assertThat(loads.get()).isEqualTo(3);
            assertThat(delayed).hasSize(2);
            assertThat(view.getState()).isEqualTo(DashboardState.SUBSCRIBED);
        }

        @Test
        void failedReload_KeepsLastSnapshotAndReturnsToSubscribed() {
            // Arrange
            view.mount();
            subscriptions.listener.onChange(inventoryInsert("item-1"));
            failLoads = true;

            // Act
            runDelayed(0);

            // Assert
            assertThat(publishedSnapshots()).hasSize(1);
            assertThat(view.getState()).isEqualTo(DashboardState.SUBSCRIBED);
        }
    }

    @Nested
    @DisplayName("unmount")
    class Unmount {

        @Test
        void unmount_CancelsPendingReloadAndReleasesScope() {
            // Arrange
            view.mount();
            subscriptions.listener.onChange(inventoryInsert("item-1"));

            // Act
            boolean released = view.unmount();
            runDelayed(0);

            // Assert
            assertThat(released).isTrue();
            verify(pendingFuture).cancel(false);
            assertThat(subscriptions.closed).containsExactly(BASE_SCOPE + "#1");
            assertThat(view.getState()).isEqualTo(DashboardState.IDLE);
            assertThat(loads.get()).isEqualTo(1);
        }

        @Test
        void unmount_DuringReload_DiscardsReloadedSnapshot() {
            // Arrange
            duringLoad = load -> {
                if (load == 2) {
                    view.unmount();
                }
            };
            view.mount();
            subscriptions.listener.onChange(inventoryInsert("item-1"));

            // Act
            runDelayed(0);

            // Assert
            assertThat(loads.get()).isEqualTo(2);
            assertThat(publishedSnapshots()).hasSize(1);
            assertThat(view.getState()).isEqualTo(DashboardState.IDLE);
        }

        @Test
        void unmount_WhileSubscribing_ReleasesLateSubscriptions() {
            // Arrange
            CompletableFuture<SubscriptionSet> pending = new CompletableFuture<>();
            subscriptions.nextResult = pending;
            view.mount();

            // Act
            view.unmount();
            pending.complete(new SubscriptionSet(BASE_SCOPE + "#1", List.of(), Map.of()));

            // Assert
            assertThat(subscriptions.closed).containsExactly(BASE_SCOPE + "#1", BASE_SCOPE + "#1");
            assertThat(view.getState()).isEqualTo(DashboardState.IDLE);
            assertThat(publishedStatuses()).isEmpty();
        }

        @Test
        void unmount_Twice_SecondCallIsNoOp() {
            // Arrange
            view.mount();

            // Act
            boolean first = view.unmount();
            boolean second = view.unmount();

            // Assert
            assertThat(first).isTrue();
            assertThat(second).isFalse();
            assertThat(subscriptions.closed).hasSize(1);
        }

        @Test
        void changeAfterUnmount_IsIgnored() {
            // Arrange
            view.mount();
            ChangeListener listener = subscriptions.listener;
            view.unmount();

            // Act
            listener.onChange(inventoryInsert("item-1"));

            // Assert
            assertThat(delayed).isEmpty();
        }

        @Test
        void remount_UsesFreshScope() {
            // Arrange
            view.mount();
            view.unmount();

            // Act
            view.mount();

            // Assert
            assertThat(subscriptions.opened).containsExactly(BASE_SCOPE + "#1", BASE_SCOPE + "#2");
            assertThat(publishedSnapshots()).extracting(DashboardSnapshot::getVersion).containsExactly(1L, 1L);
        }

        @Test
        void release_NeverMountedView_RefusesLaterMount() {
            // Act
            boolean released = view.release();
            boolean mounted = view.mount();

            // Assert
            assertThat(released).isFalse();
            assertThat(mounted).isFalse();
            assertThat(loads.get()).isZero();
            assertThat(subscriptions.opened).isEmpty();
            assertThat(view.getState()).isEqualTo(DashboardState.IDLE);
        }

        @Test
        void release_MountedView_UnmountsAndRefusesRemount() {
            // Arrange
            view.mount();

            // Act
            boolean released = view.release();
            boolean remounted = view.mount();

            // Assert
            assertThat(released).isTrue();
            assertThat(remounted).isFalse();
            assertThat(subscriptions.closed).containsExactly(BASE_SCOPE + "#1");
            assertThat(subscriptions.opened).containsExactly(BASE_SCOPE + "#1");
        }
    }

    @Nested
    @DisplayName("connectivity")
    class Connectivity {

        private static final String CHANNEL = "inventory_items_changes";

        private DashboardStatus lastStatus() {
            List<DashboardStatus> statuses = publishedStatuses();
            return statuses.get(statuses.size() - 1);
        }

        @Test
        void channelLost_PublishesDisconnectedStatusAndKeepsSnapshot() {
            // Arrange
            view.mount();

            // Act
            subscriptions.listener.onConnectivityChange(CHANNEL, false);

            // Assert
            DashboardStatus status = lastStatus();
            assertThat(status.isConnected()).isFalse();
            assertThat(status.getError()).isEqualTo(DashboardView.CONNECTION_LOST);
            assertThat(status.getFailedChannels()).containsExactly(CHANNEL);
            assertThat(publishedSnapshots()).hasSize(1);
            assertThat(view.getState()).isEqualTo(DashboardState.SUBSCRIBED);
            assertThat(delayed).isEmpty();
        }

        @Test
        void channelRestored_ReportsConnectedAndReloads() {
            // Arrange
            view.mount();
            subscriptions.listener.onConnectivityChange(CHANNEL, false);

            // Act
            subscriptions.listener.onConnectivityChange(CHANNEL, true);

            // Assert
            assertThat(lastStatus().isConnected()).isTrue();
            assertThat(lastStatus().getError()).isNull();
            assertThat(delayed).hasSize(1);

            runDelayed(0);

            assertThat(loads.get()).isEqualTo(2);
            assertThat(publishedSnapshots()).hasSize(2);
        }

        @Test
        void oneOfTwoLostChannelsRestored_StaysDisconnected() {
            // Arrange
            view.mount();
            subscriptions.listener.onConnectivityChange(CHANNEL, false);
            subscriptions.listener.onConnectivityChange("deliveries_changes", false);

            // Act
            subscriptions.listener.onConnectivityChange(CHANNEL, true);

            // Assert
            assertThat(lastStatus().isConnected()).isFalse();
            assertThat(lastStatus().getFailedChannels()).containsExactly(CHANNEL, "deliveries_changes");
            assertThat(delayed).isEmpty();
        }

        @Test
        void restoredChannel_KeepsReportingChannelsThatNeverSubscribed() {
            // Arrange
            subscriptions.nextResult = CompletableFuture.completedFuture(new SubscriptionSet(BASE_SCOPE + "#1",
                    List.of(), Map.of("deliveries_changes", new ConnectionException("Channel refused"))));
            view.mount();
            subscriptions.listener.onConnectivityChange(CHANNEL, false);

            // Act
            subscriptions.listener.onConnectivityChange(CHANNEL, true);

            // Assert
            assertThat(lastStatus().isConnected()).isFalse();
            assertThat(lastStatus().getError()).isEqualTo(DashboardView.CHANNELS_FAILED);
            assertThat(lastStatus().getFailedChannels()).containsExactly("deliveries_changes");
        }

        @Test
        void channelLostWhileLoading_ReportedOnceSubscribed() {
            // Arrange
            duringLoad = load -> view.onConnectivityChange(CHANNEL, false);

            // Act
            view.mount();

            // Assert
            List<DashboardStatus> statuses = publishedStatuses();
            assertThat(statuses).hasSize(1);
            assertThat(statuses.get(0).isConnected()).isFalse();
            assertThat(statuses.get(0).getError()).isEqualTo(DashboardView.CONNECTION_LOST);
        }

        @Test
        void connectivityAfterUnmount_IsIgnored() {
            // Arrange
            view.mount();
            ChangeListener listener = subscriptions.listener;
            view.unmount();

            // Act
            listener.onConnectivityChange(CHANNEL, false);

            // Assert
            assertThat(publishedStatuses()).hasSize(1);
            assertThat(publishedStatuses().get(0).isConnected()).isTrue();
        }
    }

    private static final class StubSubscriptions implements ViewSubscriptions {
        private final List<String> opened = new ArrayList<>();
        private final List<String> closed = new ArrayList<>();
        private ChangeListener listener;
        private CompletableFuture<SubscriptionSet> nextResult;

        @Override
        public CompletableFuture<SubscriptionSet> open(String scopeId, ChangeListener listener) {
            opened.add(scopeId);
            this.listener = listener;
            if (nextResult != null) {
                return nextResult;
            }
            return CompletableFuture.completedFuture(new SubscriptionSet(scopeId, List.of(), Map.of()));
        }

        @Override
        public void close(String scopeId) {
            closed.add(scopeId);
        }
    }
}
