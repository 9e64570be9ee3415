package com.opsdash.realtimeservice.feed;

import lombok.NonNull;
import lombok.Value;

/**
 * Equality predicate on one column, the only filter shape the change feed supports.
 * Rendered as {@code column=eq.value} in channel names.
 */
@Value
public class RowFilter {
    @NonNull String column;
    @NonNull String value;

    public static RowFilter eq(String column, String value) {
        return new RowFilter(column, value);
    }

    /**
     * True when either side of the change carries the filtered value, so a row moving
     * out of the filter still reaches the subscriber once.
     */
    public boolean matches(ChangeEvent event) {
        return event.newRecord().map(this::matches).orElse(false)
                || event.oldRecord().map(this::matches).orElse(false);
    }

    public boolean matches(RowRecord row) {
        return value.equals(row.getString(column));
    }

    public String toExpression() {
        return column + "=eq." + value;
    }
}
