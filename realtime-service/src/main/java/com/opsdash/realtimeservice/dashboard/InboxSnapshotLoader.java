package com.opsdash.realtimeservice.dashboard;

import com.opsdash.common.result.Result;
import com.opsdash.realtimeservice.config.RealtimeProperties;
import com.opsdash.realtimeservice.dto.DashboardSnapshot;
import com.opsdash.realtimeservice.dto.NotificationDto;
import com.opsdash.realtimeservice.service.NotificationInboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads a user's latest notifications and unread count for an inbox view.
 */
@Component
@RequiredArgsConstructor
public class InboxSnapshotLoader {

    private final NotificationInboxService notificationInboxService;
    private final RealtimeProperties properties;

    public SnapshotLoader forRecipient(String recipientId) {
        return () -> load(recipientId);
    }

    DashboardSnapshot load(String recipientId) {
        Result<List<NotificationDto>> latest = notificationInboxService.getLatest(recipientId, properties.getInboxPageSize());
        Result<Long> unread = notificationInboxService.getUnreadCount(recipientId);

        // the view keeps its previous snapshot when the inbox cannot be read
        if (latest.isFailure()) {
            throw latest.getError();
        }
        if (unread.isFailure()) {
            throw unread.getError();
        }

        return DashboardSnapshot.builder()
                .kind(DashboardViewKind.NOTIFICATION_INBOX)
                .notifications(latest.getData())
                .unreadCount(unread.getData())
                .build();
    }
}
