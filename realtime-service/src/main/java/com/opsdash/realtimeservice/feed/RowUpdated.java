package com.opsdash.realtimeservice.feed;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Update event. The old row only carries the primary key unless the table
 * publishes full replica identity.
 */
@Value
public class RowUpdated implements ChangeEvent {
    @NonNull String topic;
    @NonNull RowRecord newRow;
    RowRecord oldRow;
    @NonNull Instant receivedAt;

    @Override
    public ChangeEventType getEventType() {
        return ChangeEventType.UPDATE;
    }

    @Override
    public Optional<RowRecord> newRecord() {
        return Optional.of(newRow);
    }

    @Override
    public Optional<RowRecord> oldRecord() {
        return Optional.ofNullable(oldRow);
    }
}
