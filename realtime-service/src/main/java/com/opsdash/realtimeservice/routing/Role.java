package com.opsdash.realtimeservice.routing;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Dashboard roles as carried in the JWT "role" claim, with the topic groups each one sees.
 */
public enum Role {
    ADMIN("Admin", EnumSet.allOf(TopicGroup.class)),
    MANAGER("Manager", EnumSet.of(TopicGroup.PROJECTS, TopicGroup.PROCUREMENT, TopicGroup.WORKFLOW)),
    PROJECT_MANAGER("Project Manager", EnumSet.of(TopicGroup.PROJECTS, TopicGroup.WORKFLOW)),
    EMPLOYEE("Employee", EnumSet.of(TopicGroup.INVENTORY)),
    PROCUREMENT_STAFF("Procurement Staff", EnumSet.of(TopicGroup.PROCUREMENT)),
    MAINTENANCE_STAFF("Maintenance Staff", EnumSet.of(TopicGroup.MAINTENANCE)),
    DOCUMENT_ANALYST("Document Analyst", EnumSet.of(TopicGroup.DOCUMENTS));

    private final String displayName;
    private final Set<TopicGroup> groups;

    Role(String displayName, EnumSet<TopicGroup> groups) {
        this.displayName = displayName;
        this.groups = Collections.unmodifiableSet(groups);
    }

    public String getDisplayName() {
        return displayName;
    }

    public Set<TopicGroup> getGroups() {
        return groups;
    }

    /**
     * Accepts the display name ("Project Manager") or the constant name ("PROJECT_MANAGER",
     * "project_manager").
     */
    public static Optional<Role> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(role -> role.displayName.equalsIgnoreCase(trimmed)
                        || role.name().equals(trimmed.toUpperCase(Locale.ROOT).replace(' ', '_')))
                .findFirst();
    }
}
