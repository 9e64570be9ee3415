package com.opsdash.realtimeservice.controller;

import com.opsdash.common.exception.AccessDeniedException;
import com.opsdash.common.exception.ValidationException;
import com.opsdash.common.result.Result;
import com.opsdash.realtimeservice.config.WebSocketAuthInterceptor;
import com.opsdash.realtimeservice.dto.BroadcastRequest;
import com.opsdash.realtimeservice.dto.BroadcastResult;
import com.opsdash.realtimeservice.dto.BulkUpdateResponse;
import com.opsdash.realtimeservice.dto.CreateNotificationRequest;
import com.opsdash.realtimeservice.dto.NotificationDto;
import com.opsdash.realtimeservice.dto.NotificationQuery;
import com.opsdash.realtimeservice.dto.NotificationStats;
import com.opsdash.realtimeservice.dto.UnreadCountResponse;
import com.opsdash.realtimeservice.model.NotificationType;
import com.opsdash.realtimeservice.routing.Role;
import com.opsdash.realtimeservice.service.NotificationInboxService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * REST API of the notification inbox. The caller is always the JWT subject; a user can only
 * read and change their own notifications.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class NotificationController {

    private final NotificationInboxService notificationInboxService;

    /**
     * GET /api/v1/notifications?page=0&size=20&type=workflow&from=...&to=...&unreadOnly=true
     */
    @GetMapping("/notifications")
    public ResponseEntity<Page<NotificationDto>> getNotifications(
            Authentication authentication,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(name = "type", required = false) List<String> types,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "false") boolean unreadOnly) {

        String userId = extractUserId(authentication);
        log.info("Getting notifications: userId={}, page={}, size={}, types={}, unreadOnly={}",
                userId, page, size, types, unreadOnly);

        NotificationQuery query = NotificationQuery.builder()
                .page(page)
                .size(size)
                .types(parseTypes(types))
                .from(from)
                .to(to)
                .unreadOnly(unreadOnly)
                .build();

        return ResponseEntity.ok(unwrap(notificationInboxService.getForUser(userId, query)));
    }

    @GetMapping("/notifications/unread-count")
    public ResponseEntity<UnreadCountResponse> getUnreadCount(Authentication authentication) {
        String userId = extractUserId(authentication);
        return ResponseEntity.ok(new UnreadCountResponse(unwrap(notificationInboxService.getUnreadCount(userId))));
    }

    @GetMapping("/notifications/stats")
    public ResponseEntity<NotificationStats> getStats(Authentication authentication) {
        String userId = extractUserId(authentication);
        return ResponseEntity.ok(unwrap(notificationInboxService.getStats(userId)));
    }

    @PostMapping("/notifications")
    public ResponseEntity<NotificationDto> createNotification(
            Authentication authentication,
            @Valid @RequestBody CreateNotificationRequest request) {

        log.info("Creating notification: createdBy={}, recipientId={}, type={}",
                extractUserId(authentication), request.getRecipientId(), request.getType());

        NotificationDto created = unwrap(notificationInboxService.create(
                request.getRecipientId(),
                request.getType(),
                request.getTitle(),
                request.getMessage(),
                request.getRelatedEntity(),
                request.getPriority()));

        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/notifications/{id}/read")
    public ResponseEntity<NotificationDto> markAsRead(@PathVariable UUID id, Authentication authentication) {
        String userId = extractUserId(authentication);
        log.info("Marking notification as read: notificationId={}, userId={}", id, userId);
        return ResponseEntity.ok(unwrap(notificationInboxService.markAsRead(id, userId)));
    }

    @PutMapping("/notifications/read-all")
    public ResponseEntity<BulkUpdateResponse> markAllAsRead(Authentication authentication) {
        String userId = extractUserId(authentication);
        log.info("Marking all notifications as read: userId={}", userId);
        return ResponseEntity.ok(new BulkUpdateResponse(unwrap(notificationInboxService.markAllAsRead(userId))));
    }

    @DeleteMapping("/notifications/{id}")
    public ResponseEntity<NotificationDto> deleteNotification(@PathVariable UUID id, Authentication authentication) {
        String userId = extractUserId(authentication);
        log.info("Deleting notification: notificationId={}, userId={}", id, userId);
        return ResponseEntity.ok(unwrap(notificationInboxService.delete(id, userId)));
    }

    /**
     * Admin-only system announcement to every active user. A partially failed broadcast still
     * answers 200; the body lists the recipients that were missed.
     */
    @PostMapping("/announcements")
    public ResponseEntity<BroadcastResult> broadcast(
            Authentication authentication,
            @Valid @RequestBody BroadcastRequest request) {

        Jwt jwt = extractJwt(authentication);
        Role role = Role.fromValue(jwt.getClaimAsString(WebSocketAuthInterceptor.ROLE_CLAIM)).orElse(null);
        if (role != Role.ADMIN) {
            throw new AccessDeniedException("Only administrators can send announcements");
        }

        log.info("Broadcasting announcement: adminId={}, title={}", jwt.getSubject(), request.getTitle());

        Result<BroadcastResult> result = notificationInboxService.createBroadcast(
                request.getTitle(), request.getMessage(), request.getPriority());
        if (result.getData() == null) {
            throw result.getError();
        }
        return ResponseEntity.ok(result.getData());
    }

    private Set<NotificationType> parseTypes(List<String> types) {
        if (types == null || types.isEmpty()) {
            return Set.of();
        }
        Set<NotificationType> parsed = EnumSet.noneOf(NotificationType.class);
        for (String type : types) {
            parsed.add(NotificationType.fromValue(type)
                    .orElseThrow(() -> new ValidationException("type", "Unknown notification type: " + type)));
        }
        return parsed;
    }

    private static <T> T unwrap(Result<T> result) {
        if (result.isFailure()) {
            throw result.getError();
        }
        return result.getData();
    }

    private String extractUserId(Authentication authentication) {
        return extractJwt(authentication).getSubject();
    }

    private Jwt extractJwt(Authentication authentication) {
        if (authentication.getPrincipal() instanceof Jwt jwt) {
            return jwt;
        }
        throw new IllegalStateException("Invalid authentication principal");
    }
}
