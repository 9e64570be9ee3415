package com.opsdash.realtimeservice.feed;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

@Value
public class RowDeleted implements ChangeEvent {
    @NonNull String topic;
    @NonNull RowRecord oldRow;
    @NonNull Instant receivedAt;

    @Override
    public ChangeEventType getEventType() {
        return ChangeEventType.DELETE;
    }

    @Override
    public Optional<RowRecord> newRecord() {
        return Optional.empty();
    }

    @Override
    public Optional<RowRecord> oldRecord() {
        return Optional.of(oldRow);
    }
}
