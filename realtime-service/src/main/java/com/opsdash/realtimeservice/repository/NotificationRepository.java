package com.opsdash.realtimeservice.repository;

import com.opsdash.realtimeservice.model.Notification;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID>, JpaSpecificationExecutor<Notification> {

    long countByRecipientIdAndIsReadFalse(String recipientId);

    long countByRecipientId(String recipientId);

    long countByRecipientIdAndCreatedAtAfter(String recipientId, Instant since);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT n FROM Notification n WHERE n.recipientId = :recipientId AND n.isRead = false")
    List<Notification> findUnreadForUpdate(@Param("recipientId") String recipientId);

    /**
     * Flips one notification to read. The unread guard makes concurrent callers race on the
     * row: exactly one of them sees 1, so readAt is written once.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Notification n SET n.isRead = true, n.readAt = :readAt WHERE n.id = :id AND n.isRead = false")
    int markAsReadIfUnread(@Param("id") UUID id, @Param("readAt") Instant readAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Notification n SET n.isRead = true, n.readAt = :readAt WHERE n.id IN :ids AND n.isRead = false")
    int markAsReadByIds(@Param("ids") Collection<UUID> ids, @Param("readAt") Instant readAt);

    /**
     * Flips every unread notification of one recipient and returns them as they were before.
     * The selected rows stay locked until commit, so no concurrent reader flips them in
     * between, and rows inserted meanwhile stay unread.
     */
    @Transactional
    default List<Notification> markAllAsRead(String recipientId, Instant readAt) {
        List<Notification> unread = findUnreadForUpdate(recipientId);
        if (!unread.isEmpty()) {
            markAsReadByIds(unread.stream().map(Notification::getId).toList(), readAt);
        }
        return unread;
    }
}
