package com.opsdash.realtimeservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of notification shown in a user's inbox.
 */
public enum NotificationType {
    INFO,
    SUCCESS,
    WARNING,
    ERROR,
    WORKFLOW,
    ANNOUNCEMENT,
    PROJECT,
    INVENTORY;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<NotificationType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
