package com.opsdash.realtimeservice.feed;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

@Value
public class RowInserted implements ChangeEvent {
    @NonNull String topic;
    @NonNull RowRecord newRow;
    @NonNull Instant receivedAt;

    @Override
    public ChangeEventType getEventType() {
        return ChangeEventType.INSERT;
    }

    @Override
    public Optional<RowRecord> newRecord() {
        return Optional.of(newRow);
    }

    @Override
    public Optional<RowRecord> oldRecord() {
        return Optional.empty();
    }
}
