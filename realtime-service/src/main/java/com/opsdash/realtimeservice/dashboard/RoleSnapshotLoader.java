package com.opsdash.realtimeservice.dashboard;

import com.opsdash.realtimeservice.config.RealtimeProperties;
import com.opsdash.realtimeservice.dto.DashboardSnapshot;
import com.opsdash.realtimeservice.routing.RoleTopicRouter;
import com.opsdash.realtimeservice.routing.Topic;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the tables behind a role dashboard. Table names only ever come from {@link Topic}.
 * A table that cannot be read is reported as unavailable instead of failing the snapshot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoleSnapshotLoader {

    private final JdbcTemplate jdbcTemplate;
    private final RoleTopicRouter roleTopicRouter;
    private final RealtimeProperties properties;

    public SnapshotLoader forRole(String role) {
        return () -> load(role);
    }

    DashboardSnapshot load(String role) {
        Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();
        List<String> unavailable = new ArrayList<>();

        for (Topic topic : roleTopicRouter.topicsForRole(role)) {
            try {
                List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                        "SELECT * FROM " + topic.getTable() + " LIMIT ?", properties.getSnapshotRowLimit());
                tables.put(topic.getTable(), rows);
            } catch (DataAccessException e) {
                log.warn("Table unavailable for snapshot: table={}, error={}", topic.getTable(), e.getMessage());
                unavailable.add(topic.getTable());
            }
        }

        return DashboardSnapshot.builder()
                .kind(DashboardViewKind.ROLE_DASHBOARD)
                .tables(tables)
                .unavailableTables(unavailable)
                .build();
    }
}
