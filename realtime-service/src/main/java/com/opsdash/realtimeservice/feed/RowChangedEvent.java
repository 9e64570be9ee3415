package com.opsdash.realtimeservice.feed;

import lombok.Value;

import java.util.Map;

/**
 * Spring application event raised by writers of the row store.
 * Relayed to the change feed by {@link RowChangePublisher} once the write is committed.
 */
@Value
public class RowChangedEvent {
    String table;
    ChangeEventType eventType;
    Map<String, Object> newRow;
    Map<String, Object> oldRow;

    public static RowChangedEvent inserted(String table, Map<String, Object> row) {
        return new RowChangedEvent(table, ChangeEventType.INSERT, row, null);
    }

    public static RowChangedEvent updated(String table, Map<String, Object> newRow, Map<String, Object> oldRow) {
        return new RowChangedEvent(table, ChangeEventType.UPDATE, newRow, oldRow);
    }

    public static RowChangedEvent deleted(String table, Map<String, Object> row) {
        return new RowChangedEvent(table, ChangeEventType.DELETE, null, row);
    }
}
