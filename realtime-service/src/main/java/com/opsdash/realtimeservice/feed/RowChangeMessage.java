package com.opsdash.realtimeservice.feed;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Wire format of a row change on row_changes_exchange.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RowChangeMessage {
    private String table;
    private ChangeEventType eventType;
    private Map<String, Object> newRecord;
    private Map<String, Object> oldRecord;
    private Instant commitTimestamp;
}
