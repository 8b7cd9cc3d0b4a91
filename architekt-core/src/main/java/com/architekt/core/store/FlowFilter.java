package com.architekt.core.store;

import com.architekt.core.model.Flow;
import com.architekt.core.util.Tags;

import java.util.List;

/**
 * Criteria for listing flows.
 *
 * @param scopeSystemId keep flows whose scope contains this system; null keeps all
 * @param tags keep flows carrying every one of these tags; empty keeps all
 */
public record FlowFilter(String scopeSystemId, List<String> tags) {

    /**
     * Compact constructor with defaults.
     */
    public FlowFilter {
        tags = Tags.normalize(tags);
    }

    public static FlowFilter none() {
        return new FlowFilter(null, List.of());
    }

    /**
     * Tests a flow against the criteria.
     *
     * @param flow flow to test
     * @return true when the flow matches
     */
    public boolean matches(Flow flow) {
        if (scopeSystemId != null && !flow.systemScopeIds().contains(scopeSystemId)) {
            return false;
        }
        return Tags.containsAll(flow.tags(), tags);
    }
}
