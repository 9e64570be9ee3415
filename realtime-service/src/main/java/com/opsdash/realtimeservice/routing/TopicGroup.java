package com.opsdash.realtimeservice.routing;

/**
 * Functional area a topic belongs to. Roles are granted whole groups.
 */
public enum TopicGroup {
    PROJECTS,
    PROCUREMENT,
    WORKFLOW,
    INVENTORY,
    MAINTENANCE,
    DOCUMENTS,
    SYSTEM,
    IDENTITY
}
