package com.opsdash.realtimeservice.dashboard;

import com.opsdash.realtimeservice.dto.DashboardSnapshot;

/**
 * Full re-fetch of the data behind one view. Called off the view's lock and may block.
 */
@FunctionalInterface
public interface SnapshotLoader {

    DashboardSnapshot load();
}
