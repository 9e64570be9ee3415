package com.opsdash.realtimeservice.feed;

import java.time.Instant;
import java.util.Optional;

/**
 * A row change delivered by the change feed.
 *
 * One final type per operation, so consumers branch on the type instead of probing
 * for a new or old record. Delivery is at-least-once and consumers must be idempotent.
 */
public sealed interface ChangeEvent permits RowInserted, RowUpdated, RowDeleted {

    String getTopic();

    ChangeEventType getEventType();

    Instant getReceivedAt();

    Optional<RowRecord> newRecord();

    Optional<RowRecord> oldRecord();

    static ChangeEvent of(String topic, ChangeEventType type, RowRecord newRecord, RowRecord oldRecord,
                          Instant receivedAt) {
        return switch (type) {
            case INSERT -> new RowInserted(topic, newRecord, receivedAt);
            case UPDATE -> new RowUpdated(topic, newRecord, oldRecord, receivedAt);
            case DELETE -> new RowDeleted(topic, oldRecord, receivedAt);
        };
    }
}
