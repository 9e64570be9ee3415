package com.opsdash.realtimeservice.registry;

import com.opsdash.common.exception.OpsDashException;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a grouped subscribe. Topics that failed are listed in {@code failures},
 * keyed by channel name; the rest are live in {@code handles}.
 */
@Value
public class SubscriptionSet {
    String scopeId;
    List<SubscriptionHandle> handles;
    Map<String, OpsDashException> failures;

    public boolean isDegraded() {
        return !failures.isEmpty();
    }

    public boolean isEmpty() {
        return handles.isEmpty() && failures.isEmpty();
    }
}
