package com.opsdash.realtimeservice.feed;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Column values of one row as carried by the change feed, keyed by column name.
 */
@EqualsAndHashCode
public final class RowRecord {

    private static final RowRecord EMPTY = new RowRecord(Map.of());

    private final Map<String, Object> values;

    private RowRecord(Map<String, Object> values) {
        this.values = values;
    }

    public static RowRecord of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        // LinkedHashMap keeps column order and tolerates null column values
        return new RowRecord(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static RowRecord empty() {
        return EMPTY;
    }

    public Object get(String column) {
        return values.get(column);
    }

    public String getString(String column) {
        Object value = values.get(column);
        return value != null ? value.toString() : null;
    }

    @Override
    public String toString() {
        return "RowRecord" + values;
    }
}
