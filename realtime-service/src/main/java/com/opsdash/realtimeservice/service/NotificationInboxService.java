package com.opsdash.realtimeservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.opsdash.common.exception.AccessDeniedException;
import com.opsdash.common.exception.ConnectionException;
import com.opsdash.common.exception.OpsDashException;
import com.opsdash.common.exception.PartialBatchException;
import com.opsdash.common.exception.ResourceNotFoundException;
import com.opsdash.common.exception.ValidationException;
import com.opsdash.common.result.Result;
import com.opsdash.realtimeservice.dto.BroadcastResult;
import com.opsdash.realtimeservice.dto.NotificationDraft;
import com.opsdash.realtimeservice.dto.NotificationDto;
import com.opsdash.realtimeservice.dto.NotificationQuery;
import com.opsdash.realtimeservice.dto.NotificationStats;
import com.opsdash.realtimeservice.dto.RelatedEntity;
import com.opsdash.realtimeservice.feed.RowChangedEvent;
import com.opsdash.realtimeservice.mapper.NotificationMapper;
import com.opsdash.realtimeservice.mapper.RelatedEntityConverter;
import com.opsdash.realtimeservice.model.Notification;
import com.opsdash.realtimeservice.model.NotificationPriority;
import com.opsdash.realtimeservice.model.NotificationType;
import com.opsdash.realtimeservice.model.UserAccount;
import com.opsdash.realtimeservice.repository.NotificationRepository;
import com.opsdash.realtimeservice.repository.NotificationSpecifications;
import com.opsdash.realtimeservice.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-user notification inbox.
 *
 * Every operation reports its outcome as a {@link Result} instead of throwing. Each write
 * runs in its own transaction, so a broadcast keeps the notifications that were stored even
 * when some recipients fail. Stored changes are announced on the change feed as rows of the
 * notifications table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationInboxService {

    private static final Duration RECENT_WINDOW = Duration.ofHours(24);
    private static final int MAX_PAGE_SIZE = 200;

    private final NotificationRepository notificationRepository;
    private final UserAccountRepository userAccountRepository;
    private final NotificationMapper notificationMapper;
    private final RelatedEntityConverter relatedEntityConverter;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates a notification from raw values, as received over REST.
     *
     * @param priority priority name, defaults to medium when null
     */
    public Result<NotificationDto> create(String recipientId, String type, String title, String message,
                                          RelatedEntity relatedEntity, String priority) {
        Optional<NotificationType> parsedType = NotificationType.fromValue(type);
        if (parsedType.isEmpty()) {
            return Result.failure(new ValidationException("type", "Unknown notification type: " + type));
        }
        Result<NotificationPriority> parsedPriority = parsePriority(priority);
        if (parsedPriority.isFailure()) {
            return Result.failure(parsedPriority.getError());
        }

        return create(NotificationDraft.builder()
                .recipientId(recipientId)
                .type(parsedType.get())
                .title(title)
                .message(message)
                .relatedEntity(relatedEntity)
                .priority(parsedPriority.getData())
                .build());
    }

    public Result<NotificationDto> create(NotificationDraft draft) {
        Optional<ValidationException> invalid = validate(draft);
        if (invalid.isPresent()) {
            log.warn("Rejected notification: field={}, reason={}", invalid.get().getField(), invalid.get().getMessage());
            return Result.failure(invalid.get());
        }

        try {
            Notification saved = notificationRepository.save(toEntity(draft));
            eventPublisher.publishEvent(RowChangedEvent.inserted(NotificationRows.TABLE, NotificationRows.toRow(saved)));
            log.info("Notification created: id={}, recipientId={}, type={}, priority={}",
                    saved.getId(), saved.getRecipientId(), saved.getType(), saved.getPriority());
            return Result.ok(notificationMapper.toDto(saved));
        } catch (JsonProcessingException e) {
            return Result.failure(new ValidationException("relatedEntity", "Metadata is not serializable: "
                    + e.getOriginalMessage()));
        } catch (DataAccessException e) {
            log.error("Failed to store notification: recipientId={}, error={}", draft.getRecipientId(), e.getMessage());
            return Result.failure(new ConnectionException("Failed to store notification", e));
        }
    }

    /**
     * Sends a system announcement to every active user, one insert per user.
     *
     * Not atomic: when some inserts fail, the result carries the delivered notifications and a
     * {@link PartialBatchException} naming the recipients that were missed.
     */
    public Result<BroadcastResult> createBroadcast(String title, String message, String priority) {
        Result<NotificationPriority> parsedPriority = parsePriority(priority);
        if (parsedPriority.isFailure()) {
            return Result.failure(parsedPriority.getError());
        }
        NotificationDraft announcement = NotificationDrafts.systemAnnouncement(title, message, parsedPriority.getData());
        Optional<ValidationException> invalid = validateContent(announcement);
        if (invalid.isPresent()) {
            return Result.failure(invalid.get());
        }

        List<UserAccount> recipients;
        try {
            recipients = userAccountRepository.findByIsActiveTrue();
        } catch (DataAccessException e) {
            log.error("Failed to load broadcast recipients: {}", e.getMessage());
            return Result.failure(new ConnectionException("Failed to load active users", e));
        }

        List<NotificationDto> delivered = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (UserAccount recipient : recipients) {
            Result<NotificationDto> result = create(announcement.forRecipient(recipient.getId()));
            if (result.isOk()) {
                delivered.add(result.getData());
            } else {
                failed.add(recipient.getId());
            }
        }

        BroadcastResult outcome = new BroadcastResult(recipients.size(), delivered, failed);
        if (failed.isEmpty()) {
            log.info("Broadcast sent: title={}, recipients={}", title, recipients.size());
            return Result.ok(outcome);
        }

        log.warn("Broadcast partially failed: title={}, delivered={}, failed={}", title, delivered.size(), failed);
        return Result.partial(outcome, new PartialBatchException(failed, recipients.size()));
    }

    /**
     * Recipient's notifications, newest first, narrowed by {@code query}.
     */
    public Result<Page<NotificationDto>> getForUser(String recipientId, NotificationQuery query) {
        if (isBlank(recipientId)) {
            return Result.failure(new ValidationException("recipientId", "Recipient is required"));
        }
        if (query.getPage() < 0) {
            return Result.failure(new ValidationException("page", "Page number must not be less than zero"));
        }
        if (query.getSize() < 1 || query.getSize() > MAX_PAGE_SIZE) {
            return Result.failure(new ValidationException("size", "Page size must be between 1 and " + MAX_PAGE_SIZE));
        }
        if (query.getFrom() != null && query.getTo() != null && !query.getFrom().isBefore(query.getTo())) {
            return Result.failure(new ValidationException("from", "Range start must be before range end"));
        }

        PageRequest pageable = PageRequest.of(query.getPage(), query.getSize(), Sort.by(Sort.Direction.DESC, "createdAt"));
        try {
            Page<Notification> page = notificationRepository.findAll(
                    NotificationSpecifications.forQuery(recipientId, query), pageable);
            return Result.ok(page.map(notificationMapper::toDto));
        } catch (DataAccessException e) {
            log.error("Failed to query notifications: recipientId={}, error={}", recipientId, e.getMessage());
            return Result.failure(new ConnectionException("Failed to query notifications", e));
        }
    }

    public Result<Long> getUnreadCount(String recipientId) {
        if (isBlank(recipientId)) {
            return Result.failure(new ValidationException("recipientId", "Recipient is required"));
        }
        try {
            return Result.ok(notificationRepository.countByRecipientIdAndIsReadFalse(recipientId));
        } catch (DataAccessException e) {
            log.error("Failed to count unread notifications: recipientId={}, error={}", recipientId, e.getMessage());
            return Result.failure(new ConnectionException("Failed to count unread notifications", e));
        }
    }

    public Result<NotificationStats> getStats(String recipientId) {
        if (isBlank(recipientId)) {
            return Result.failure(new ValidationException("recipientId", "Recipient is required"));
        }
        try {
            long unread = notificationRepository.countByRecipientIdAndIsReadFalse(recipientId);
            long total = notificationRepository.countByRecipientId(recipientId);
            long recent = notificationRepository.countByRecipientIdAndCreatedAtAfter(
                    recipientId, Instant.now().minus(RECENT_WINDOW));
            return Result.ok(new NotificationStats(unread, total, recent));
        } catch (DataAccessException e) {
            log.error("Failed to compute notification stats: recipientId={}, error={}", recipientId, e.getMessage());
            return Result.failure(new ConnectionException("Failed to compute notification stats", e));
        }
    }

    public Result<NotificationDto> markAsRead(UUID id) {
        return markAsRead(id, null);
    }

    /**
     * Marks one notification as read. Re-marking is a no-op that returns the stored state;
     * readAt keeps the time of the first transition.
     *
     * @param actingUserId when set, the notification must belong to this user
     */
    public Result<NotificationDto> markAsRead(UUID id, String actingUserId) {
        try {
            Optional<Notification> existing = notificationRepository.findById(id);
            if (existing.isEmpty()) {
                return Result.failure(notFound(id));
            }
            Notification before = existing.get();
            Optional<OpsDashException> denied = checkOwner(before, actingUserId);
            if (denied.isPresent()) {
                return Result.failure(denied.get());
            }
            if (Boolean.TRUE.equals(before.getIsRead())) {
                return Result.ok(notificationMapper.toDto(before));
            }

            int transitioned = notificationRepository.markAsReadIfUnread(id, Instant.now());
            Optional<Notification> after = notificationRepository.findById(id);
            if (after.isEmpty()) {
                return Result.failure(notFound(id));
            }
            if (transitioned == 1) {
                eventPublisher.publishEvent(RowChangedEvent.updated(NotificationRows.TABLE,
                        NotificationRows.toRow(after.get()), NotificationRows.toRow(before)));
                log.info("Notification marked as read: id={}, recipientId={}", id, before.getRecipientId());
            }
            return Result.ok(notificationMapper.toDto(after.get()));
        } catch (DataAccessException e) {
            log.error("Failed to mark notification as read: id={}, error={}", id, e.getMessage());
            return Result.failure(new ConnectionException("Failed to mark notification as read", e));
        }
    }

    /**
     * Marks every unread notification of {@code recipientId} as read. An UPDATE event is
     * published for each row this call flipped, all carrying the same readAt.
     *
     * @return number of notifications that changed state
     */
    public Result<Integer> markAllAsRead(String recipientId) {
        if (isBlank(recipientId)) {
            return Result.failure(new ValidationException("recipientId", "Recipient is required"));
        }
        try {
            Instant readAt = Instant.now();
            List<Notification> transitioned = notificationRepository.markAllAsRead(recipientId, readAt);
            for (Notification before : transitioned) {
                Notification after = copyAsRead(before, readAt);
                eventPublisher.publishEvent(RowChangedEvent.updated(NotificationRows.TABLE,
                        NotificationRows.toRow(after), NotificationRows.toRow(before)));
            }
            if (!transitioned.isEmpty()) {
                log.info("Notifications marked as read: recipientId={}, count={}", recipientId, transitioned.size());
            }
            return Result.ok(transitioned.size());
        } catch (DataAccessException e) {
            log.error("Failed to mark all notifications as read: recipientId={}, error={}", recipientId, e.getMessage());
            return Result.failure(new ConnectionException("Failed to mark notifications as read", e));
        }
    }

    public Result<NotificationDto> delete(UUID id) {
        return delete(id, null);
    }

    /**
     * Permanently removes a notification and returns it, so callers can adjust cached
     * unread counters.
     *
     * @param actingUserId when set, the notification must belong to this user
     */
    public Result<NotificationDto> delete(UUID id, String actingUserId) {
        try {
            Optional<Notification> existing = notificationRepository.findById(id);
            if (existing.isEmpty()) {
                return Result.failure(notFound(id));
            }
            Notification notification = existing.get();
            Optional<OpsDashException> denied = checkOwner(notification, actingUserId);
            if (denied.isPresent()) {
                return Result.failure(denied.get());
            }

            notificationRepository.delete(notification);
            eventPublisher.publishEvent(RowChangedEvent.deleted(NotificationRows.TABLE, NotificationRows.toRow(notification)));
            log.info("Notification deleted: id={}, recipientId={}", id, notification.getRecipientId());
            return Result.ok(notificationMapper.toDto(notification));
        } catch (DataAccessException e) {
            log.error("Failed to delete notification: id={}, error={}", id, e.getMessage());
            return Result.failure(new ConnectionException("Failed to delete notification", e));
        }
    }

    /**
     * Latest notifications of a recipient, used for inbox snapshots.
     */
    public Result<List<NotificationDto>> getLatest(String recipientId, int limit) {
        return getForUser(recipientId, NotificationQuery.firstPage(limit)).map(Page::getContent);
    }

    private Notification toEntity(NotificationDraft draft) throws JsonProcessingException {
        RelatedEntity related = draft.getRelatedEntity();
        return Notification.builder()
                .recipientId(draft.getRecipientId())
                .type(draft.getType())
                .title(draft.getTitle())
                .message(draft.getMessage())
                .priority(draft.getPriority() != null ? draft.getPriority() : NotificationPriority.MEDIUM)
                .isRead(false)
                .relatedEntityType(related != null ? related.getEntityType() : null)
                .relatedEntityId(related != null ? related.getEntityId() : null)
                .metadata(related != null ? relatedEntityConverter.writeMetadata(related.getMetadata()) : null)
                .build();
    }

    private Notification copyAsRead(Notification source, Instant readAt) {
        return Notification.builder()
                .id(source.getId())
                .recipientId(source.getRecipientId())
                .type(source.getType())
                .title(source.getTitle())
                .message(source.getMessage())
                .priority(source.getPriority())
                .isRead(true)
                .readAt(readAt)
                .relatedEntityType(source.getRelatedEntityType())
                .relatedEntityId(source.getRelatedEntityId())
                .metadata(source.getMetadata())
                .createdAt(source.getCreatedAt())
                .build();
    }

    private Optional<ValidationException> validate(NotificationDraft draft) {
        if (isBlank(draft.getRecipientId())) {
            return Optional.of(new ValidationException("recipientId", "Recipient is required"));
        }
        if (draft.getRecipientId().length() > Notification.MAX_RECIPIENT_ID_LENGTH) {
            return Optional.of(new ValidationException("recipientId",
                    "Recipient id must be at most " + Notification.MAX_RECIPIENT_ID_LENGTH + " characters"));
        }
        if (draft.getType() == null) {
            return Optional.of(new ValidationException("type", "Notification type is required"));
        }
        return validateContent(draft);
    }

    // mirrors the notifications column lengths
    private Optional<ValidationException> validateContent(NotificationDraft draft) {
        if (isBlank(draft.getTitle())) {
            return Optional.of(new ValidationException("title", "Title is required"));
        }
        if (draft.getTitle().length() > Notification.MAX_TITLE_LENGTH) {
            return Optional.of(new ValidationException("title",
                    "Title must be at most " + Notification.MAX_TITLE_LENGTH + " characters"));
        }
        if (isBlank(draft.getMessage())) {
            return Optional.of(new ValidationException("message", "Message is required"));
        }
        if (draft.getMessage().length() > Notification.MAX_MESSAGE_LENGTH) {
            return Optional.of(new ValidationException("message",
                    "Message must be at most " + Notification.MAX_MESSAGE_LENGTH + " characters"));
        }
        return Optional.empty();
    }

    private Result<NotificationPriority> parsePriority(String priority) {
        if (priority == null) {
            return Result.ok(NotificationPriority.MEDIUM);
        }
        return NotificationPriority.fromValue(priority)
                .map(Result::ok)
                .orElseGet(() -> Result.failure(new ValidationException("priority", "Unknown priority: " + priority)));
    }

    private Optional<OpsDashException> checkOwner(Notification notification, String actingUserId) {
        if (actingUserId == null || actingUserId.equals(notification.getRecipientId())) {
            return Optional.empty();
        }
        log.warn("Notification access denied: id={}, actingUserId={}", notification.getId(), actingUserId);
        return Optional.of(new AccessDeniedException("Notification " + notification.getId() + " belongs to another user"));
    }

    private static ResourceNotFoundException notFound(UUID id) {
        return new ResourceNotFoundException("Notification not found: " + id);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
