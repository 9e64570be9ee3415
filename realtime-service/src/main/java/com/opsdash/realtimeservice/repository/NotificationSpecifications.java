package com.opsdash.realtimeservice.repository;

import com.opsdash.realtimeservice.dto.NotificationQuery;
import com.opsdash.realtimeservice.model.Notification;
import org.springframework.data.jpa.domain.Specification;

/**
 * Inbox query predicates. Each returns null when its filter is not set, which
 * {@link Specification#where} treats as no restriction.
 */
public final class NotificationSpecifications {

    private NotificationSpecifications() {
    }

    public static Specification<Notification> forQuery(String recipientId, NotificationQuery query) {
        return Specification.where(recipientIs(recipientId))
                .and(typeIn(query))
                .and(createdFrom(query))
                .and(createdBefore(query))
                .and(unreadOnly(query));
    }

    static Specification<Notification> recipientIs(String recipientId) {
        return (root, cq, cb) -> cb.equal(root.get("recipientId"), recipientId);
    }

    static Specification<Notification> typeIn(NotificationQuery query) {
        if (query.getTypes() == null || query.getTypes().isEmpty()) {
            return null;
        }
        return (root, cq, cb) -> root.get("type").in(query.getTypes());
    }

    static Specification<Notification> createdFrom(NotificationQuery query) {
        if (query.getFrom() == null) {
            return null;
        }
        return (root, cq, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), query.getFrom());
    }

    static Specification<Notification> createdBefore(NotificationQuery query) {
        if (query.getTo() == null) {
            return null;
        }
        return (root, cq, cb) -> cb.lessThan(root.get("createdAt"), query.getTo());
    }

    static Specification<Notification> unreadOnly(NotificationQuery query) {
        if (!query.isUnreadOnly()) {
            return null;
        }
        return (root, cq, cb) -> cb.isFalse(root.get("isRead"));
    }
}
