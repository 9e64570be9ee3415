package com.opsdash.realtimeservice.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps a dashboard role to the topics it receives change events for.
 *
 * The mapping is static and total: an unknown role yields no topics, never an error.
 */
@Component
@Slf4j
public class RoleTopicRouter {

    private final Map<Role, Set<Topic>> topicsByRole;

    public RoleTopicRouter() {
        Map<Role, Set<Topic>> mapping = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            mapping.put(role, Topic.inGroups(role.getGroups()));
        }
        this.topicsByRole = Collections.unmodifiableMap(mapping);
    }

    public Set<Topic> topicsForRole(Role role) {
        if (role == null) {
            return Collections.emptySet();
        }
        return topicsByRole.get(role);
    }

    public Set<Topic> topicsForRole(String role) {
        return Role.fromValue(role)
                .map(this::topicsForRole)
                .orElseGet(() -> {
                    log.warn("Unknown dashboard role, no topics granted: role={}", role);
                    return Collections.emptySet();
                });
    }

    /**
     * Table names for {@code role}, in declaration order of {@link Topic}.
     */
    public Set<String> tablesForRole(String role) {
        Set<String> tables = new LinkedHashSet<>();
        for (Topic topic : topicsForRole(role)) {
            tables.add(topic.getTable());
        }
        return Collections.unmodifiableSet(tables);
    }
}
