package com.opsdash.realtimeservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum NotificationPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<NotificationPriority> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(priority -> priority.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
