package com.opsdash.realtimeservice.dashboard;

import com.opsdash.common.exception.ValidationException;
import com.opsdash.common.result.Result;
import com.opsdash.realtimeservice.config.RealtimeProperties;
import com.opsdash.realtimeservice.dto.DashboardSnapshot;
import com.opsdash.realtimeservice.feed.FakeChangeFeedClient;
import com.opsdash.realtimeservice.feed.RowFilter;
import com.opsdash.realtimeservice.registry.ChangeListener;
import com.opsdash.realtimeservice.registry.ChannelKey;
import com.opsdash.realtimeservice.registry.SubscriptionRegistry;
import com.opsdash.realtimeservice.registry.SubscriptionSet;
import com.opsdash.realtimeservice.routing.RoleTopicRouter;
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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DashboardViewManagerTest {

    private static final int RACE_ROUNDS = 5_000;

    @Mock
    private SubscriptionRegistry subscriptionRegistry;
    @Mock
    private RoleSnapshotLoader roleSnapshotLoader;
    @Mock
    private InboxSnapshotLoader inboxSnapshotLoader;
    @Mock
    private DashboardPublisher dashboardPublisher;
    @Mock
    private ThreadPoolTaskScheduler dashboardScheduler;

    private DashboardViewManager manager;

    @BeforeEach
    void setUp() {
        doAnswer(i -> {
            ((Runnable) i.getArgument(0)).run();
            return null;
        }).when(dashboardScheduler).execute(any(Runnable.class));

        SnapshotLoader emptyLoader = () -> DashboardSnapshot.builder().build();
        when(roleSnapshotLoader.forRole(anyString())).thenReturn(emptyLoader);
        when(inboxSnapshotLoader.forRecipient(anyString())).thenReturn(emptyLoader);

        when(subscriptionRegistry.subscribeToRoleScope(anyString(), anyString(), any(ChangeListener.class)))
                .thenAnswer(i -> CompletableFuture.completedFuture(
                        new SubscriptionSet(i.getArgument(0), List.of(), Map.of())));
        when(subscriptionRegistry.subscribeKeys(anyString(), any(), any(ChangeListener.class)))
                .thenAnswer(i -> CompletableFuture.completedFuture(
                        new SubscriptionSet(i.getArgument(0), List.of(), Map.of())));

        manager = new DashboardViewManager(subscriptionRegistry, roleSnapshotLoader, inboxSnapshotLoader,
                dashboardPublisher, dashboardScheduler, new RealtimeProperties());
    }

    @Test
    void mount_RoleDashboard_SubscribesToRoleTopicsUnderViewScope() {
        // Act
        Result<DashboardView> result = manager.mount("session-1", "user-1", "Employee", "inventory",
                DashboardViewKind.ROLE_DASHBOARD);

        // Assert
        assertThat(result.isOk()).isTrue();
        assertThat(result.getData().getState()).isEqualTo(DashboardState.SUBSCRIBED);
        verify(roleSnapshotLoader).forRole("Employee");
        verify(subscriptionRegistry).subscribeToRoleScope(eq("session-1/inventory/1#1"), eq("Employee"),
                any(ChangeListener.class));
        assertThat(manager.activeViewCount()).isEqualTo(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void mount_NotificationInbox_SubscribesToOwnNotificationsOnly() {
        // Act
        manager.mount("session-1", "user-1", "Employee", "inbox", DashboardViewKind.NOTIFICATION_INBOX);

        // Assert
        verify(inboxSnapshotLoader).forRecipient("user-1");
        ArgumentCaptor<Collection<ChannelKey>> keys = ArgumentCaptor.forClass(Collection.class);
        verify(subscriptionRegistry).subscribeKeys(eq("session-1/inbox/1#1"), keys.capture(), any(ChangeListener.class));
        assertThat(keys.getValue()).containsExactly(
                ChannelKey.of("notifications", RowFilter.eq("recipient_id", "user-1")));
        verify(subscriptionRegistry, never()).subscribeToRoleScope(anyString(), anyString(), any());
    }

    @Test
    void mount_NoKind_DefaultsToRoleDashboard() {
        // Act
        Result<DashboardView> result = manager.mount("session-1", "user-1", "Manager", "overview", null);

        // Assert
        assertThat(result.getData().getKind()).isEqualTo(DashboardViewKind.ROLE_DASHBOARD);
    }

    @Test
    void mount_BlankViewId_ReturnsValidationFailure() {
        // Act
        Result<DashboardView> result = manager.mount("session-1", "user-1", "Employee", " ",
                DashboardViewKind.ROLE_DASHBOARD);

        // Assert
        assertThat(result.getError()).isInstanceOf(ValidationException.class);
        assertThat(manager.activeViewCount()).isZero();
    }

    @Test
    void mount_SameViewIdAgain_ReplacesPreviousView() {
        // Arrange
        DashboardView first = manager.mount("session-1", "user-1", "Employee", "inventory",
                DashboardViewKind.ROLE_DASHBOARD).getData();

        // Act
        DashboardView second = manager.mount("session-1", "user-1", "Employee", "inventory",
                DashboardViewKind.ROLE_DASHBOARD).getData();

        // Assert
        assertThat(first.getState()).isEqualTo(DashboardState.IDLE);
        assertThat(second.getState()).isEqualTo(DashboardState.SUBSCRIBED);
        assertThat(second.getScopeId()).isEqualTo("session-1/inventory/2#1");
        verify(subscriptionRegistry).unsubscribeAll("session-1/inventory/1#1");
        assertThat(manager.activeViewCount()).isEqualTo(1);
    }

    @Test
    void unmount_ReleasesViewScope() {
        // Arrange
        manager.mount("session-1", "user-1", "Employee", "inventory", DashboardViewKind.ROLE_DASHBOARD);

        // Act
        boolean released = manager.unmount("session-1", "inventory");

        // Assert
        assertThat(released).isTrue();
        verify(subscriptionRegistry).unsubscribeAll("session-1/inventory/1#1");
        assertThat(manager.activeViewCount()).isZero();
    }

    @Test
    void unmount_UnknownView_ReturnsFalse() {
        assertThat(manager.unmount("session-1", "missing")).isFalse();
        verify(subscriptionRegistry, never()).unsubscribeAll(anyString());
    }

    @Test
    void unmountSession_ReleasesEveryViewOfTheSession() {
        // Arrange
        manager.mount("session-1", "user-1", "Employee", "inventory", DashboardViewKind.ROLE_DASHBOARD);
        manager.mount("session-1", "user-1", "Employee", "inbox", DashboardViewKind.NOTIFICATION_INBOX);
        manager.mount("session-2", "user-2", "Manager", "overview", DashboardViewKind.ROLE_DASHBOARD);

        // Act
        int released = manager.unmountSession("session-1");

        // Assert
        assertThat(released).isEqualTo(2);
        verify(subscriptionRegistry).unsubscribeAll("session-1/inventory/1#1");
        verify(subscriptionRegistry).unsubscribeAll("session-1/inbox/2#1");
        assertThat(manager.activeViewCount()).isEqualTo(1);
        assertThat(manager.unmountSession("session-1")).isZero();
    }

    @Nested
    @DisplayName("concurrent lifecycle")
    class ConcurrentLifecycle {

        private FakeChangeFeedClient feed;
        private DashboardViewManager racingManager;

        @BeforeEach
        void setUpRealRegistry() {
            feed = new FakeChangeFeedClient();
            SubscriptionRegistry registry = new SubscriptionRegistry(feed, new RoleTopicRouter(), new RealtimeProperties());

            // runs loads on the calling thread; invocations are not recorded
            RoleSnapshotLoader roles = mock(RoleSnapshotLoader.class, withSettings().stubOnly());
            when(roles.forRole(anyString())).thenReturn(() -> DashboardSnapshot.builder().build());
            InboxSnapshotLoader inbox = mock(InboxSnapshotLoader.class, withSettings().stubOnly());
            DashboardPublisher publisher = mock(DashboardPublisher.class, withSettings().stubOnly());
            ThreadPoolTaskScheduler inline = new ThreadPoolTaskScheduler() {
                @Override
                public void execute(Runnable task) {
                    task.run();
                }
            };

            racingManager = new DashboardViewManager(registry, roles, inbox, publisher, inline,
                    new RealtimeProperties());
        }

        private List<DashboardView> mountWhile(Runnable teardown) throws Exception {
            List<DashboardView> mounted = Collections.synchronizedList(new ArrayList<>());
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<?> mounting = pool.submit(() -> {
                    for (int k = 0; k < RACE_ROUNDS; k++) {
                        mounted.add(racingManager.mount("session-1", "user-1", "Employee", "v" + (k % 2),
                                DashboardViewKind.ROLE_DASHBOARD).getData());
                    }
                });
                Future<?> tearingDown = pool.submit(() -> {
                    while (!mounting.isDone()) {
                        teardown.run();
                    }
                });
                mounting.get(60, TimeUnit.SECONDS);
                tearingDown.get(60, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }
            return mounted;
        }

        @Test
        void unmountRacingMount_LeavesNoViewMountedAfterDisconnect() throws Exception {
            // Arrange
            int[] round = {0};

            // Act
            List<DashboardView> mounted = mountWhile(() -> racingManager.unmount("session-1", "v" + (round[0]++ % 2)));
            racingManager.unmountSession("session-1");

            // Assert
            assertThat(mounted).hasSize(RACE_ROUNDS)
                    .allSatisfy(view -> assertThat(view.getState()).isEqualTo(DashboardState.IDLE));
            assertThat(racingManager.activeViewCount()).isZero();
            assertThat(feed.openChannelCount()).isZero();
        }

        @Test
        void disconnectRacingMount_LeavesNoViewMountedAfterDisconnect() throws Exception {
            // Act
            List<DashboardView> mounted = mountWhile(() -> racingManager.unmountSession("session-1"));
            racingManager.unmountSession("session-1");

            // Assert
            assertThat(mounted).hasSize(RACE_ROUNDS)
                    .allSatisfy(view -> assertThat(view.getState()).isEqualTo(DashboardState.IDLE));
            assertThat(racingManager.activeViewCount()).isZero();
            assertThat(feed.openChannelCount()).isZero();
        }
    }
}
