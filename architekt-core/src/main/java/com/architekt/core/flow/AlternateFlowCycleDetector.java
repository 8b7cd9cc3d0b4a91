package com.architekt.core.flow;

import com.architekt.core.model.Flow;
import com.architekt.core.model.Step;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds cycles in the "alternate flow" relation of a project.
 *
 * <p>Flow A points at flow B when any step of A lists B in its alternate flow ids. References
 * to flows that do not exist are ignored.
 */
public final class AlternateFlowCycleDetector {

    private AlternateFlowCycleDetector() {
        // Utility class
    }

    /**
     * Searches for a cycle with a depth-first traversal that tracks the current path.
     *
     * @param flows flows of a project by id
     * @return the first cycle found as a closed path (first and last ids are equal), empty if none
     */
    public static Optional<List<String>> findCycle(Map<String, Flow> flows) {
        Set<String> done = new HashSet<>();
        for (String flowId : flows.keySet()) {
            Optional<List<String>> cycle = visit(flowId, flows, new LinkedHashSet<>(), done);
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the ids of the existing flows a flow points at.
     *
     * @param flow source flow
     * @param flows flows of the project by id
     * @return referenced flow ids in step order
     */
    public static Set<String> successors(Flow flow, Map<String, Flow> flows) {
        Set<String> successors = new LinkedHashSet<>();
        for (Step step : flow.steps()) {
            for (String alternateId : step.alternateFlowIds()) {
                if (flows.containsKey(alternateId)) {
                    successors.add(alternateId);
                }
            }
        }
        return successors;
    }

    private static Optional<List<String>> visit(String flowId, Map<String, Flow> flows,
                                                LinkedHashSet<String> path, Set<String> done) {
        if (done.contains(flowId)) {
            return Optional.empty();
        }
        if (path.contains(flowId)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String id : path) {
                inCycle |= id.equals(flowId);
                if (inCycle) {
                    cycle.add(id);
                }
            }
            cycle.add(flowId);
            return Optional.of(cycle);
        }

        path.add(flowId);
        for (String next : successors(flows.get(flowId), flows)) {
            Optional<List<String>> cycle = visit(next, flows, path, done);
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        path.remove(flowId);
        done.add(flowId);
        return Optional.empty();
    }
}
