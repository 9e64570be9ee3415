package com.opsdash.realtimeservice.routing;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * A table of the row store that publishes change events, and the group it belongs to.
 * This is the only source of table names the service ever queries or subscribes to.
 */
public enum Topic {
    PROJECTS("projects", TopicGroup.PROJECTS),

    PROCUREMENT_REQUESTS("procurement_requests", TopicGroup.PROCUREMENT),
    PURCHASE_ORDERS("purchase_orders", TopicGroup.PROCUREMENT),
    SUPPLIERS("suppliers", TopicGroup.PROCUREMENT),

    WORKFLOW_INSTANCES("workflow_instances", TopicGroup.WORKFLOW),
    WORKFLOW_APPROVALS("workflow_approvals", TopicGroup.WORKFLOW),
    APPROVAL_REQUESTS("approval_requests", TopicGroup.WORKFLOW),

    INVENTORY_ITEMS("inventory_items", TopicGroup.INVENTORY),
    DELIVERIES("deliveries", TopicGroup.INVENTORY),
    ANNOUNCEMENTS("announcements", TopicGroup.INVENTORY),

    ASSETS("assets", TopicGroup.MAINTENANCE),
    MAINTENANCE_LOGS("maintenance_logs", TopicGroup.MAINTENANCE),
    SCHEDULED_MAINTENANCE("scheduled_maintenance", TopicGroup.MAINTENANCE),

    DOCUMENTS("documents", TopicGroup.DOCUMENTS),
    VERIFICATION_QUEUE("verification_queue", TopicGroup.DOCUMENTS),
    DELIVERY_RECEIPTS("delivery_receipts", TopicGroup.DOCUMENTS),

    SYSTEM_ACTIVITIES("system_activities", TopicGroup.SYSTEM),
    AUDIT_LOGS("audit_logs", TopicGroup.SYSTEM),
    ERROR_LOGS("error_logs", TopicGroup.SYSTEM),

    USERS("users", TopicGroup.IDENTITY),
    NOTIFICATIONS("notifications", TopicGroup.IDENTITY);

    private final String table;
    private final TopicGroup group;

    Topic(String table, TopicGroup group) {
        this.table = table;
        this.group = group;
    }

    public String getTable() {
        return table;
    }

    public TopicGroup getGroup() {
        return group;
    }

    public static Optional<Topic> fromTable(String table) {
        return Arrays.stream(values())
                .filter(topic -> topic.table.equals(table))
                .findFirst();
    }

    public static Set<Topic> inGroups(Set<TopicGroup> groups) {
        EnumSet<Topic> topics = EnumSet.noneOf(Topic.class);
        for (Topic topic : values()) {
            if (groups.contains(topic.group)) {
                topics.add(topic);
            }
        }
        return Collections.unmodifiableSet(topics);
    }
}
