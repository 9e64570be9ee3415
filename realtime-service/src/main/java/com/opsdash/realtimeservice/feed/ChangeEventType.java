package com.opsdash.realtimeservice.feed;

/**
 * Row-level operation reported by the change feed.
 */
public enum ChangeEventType {
    INSERT,
    UPDATE,
    DELETE
}
