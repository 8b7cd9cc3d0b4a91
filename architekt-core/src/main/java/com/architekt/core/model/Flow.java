package com.architekt.core.model;

import com.architekt.core.util.Immutables;
import com.architekt.core.util.Tags;

import java.util.List;

/**
 * Interaction scenario scoped to a subset of a project's systems.
 *
 * <p>A flow is created, updated and deleted as a whole document. The same record is used for
 * unsaved drafts, in which case {@code id} is null.
 *
 * @param id flow id, null on drafts
 * @param name flow name
 * @param description optional description
 * @param tags normalized tags
 * @param systemScopeIds ids of the systems the steps may reference
 * @param steps ordered steps
 */
public record Flow(
    String id,
    String name,
    String description,
    List<String> tags,
    List<String> systemScopeIds,
    List<Step> steps
) {
    /**
     * Compact constructor with defaults.
     */
    public Flow {
        tags = Tags.normalize(tags);
        systemScopeIds = Tags.normalize(systemScopeIds);
        steps = Immutables.list(steps);
    }

    public Flow withId(String newId) {
        return new Flow(newId, name, description, tags, systemScopeIds, steps);
    }

    public Flow withSystemScopeIds(List<String> newScope) {
        return new Flow(id, name, description, tags, newScope, steps);
    }

    public Flow withSteps(List<Step> newSteps) {
        return new Flow(id, name, description, tags, systemScopeIds, newSteps);
    }

    /**
     * Checks whether any step lists the given flow as an alternate path.
     *
     * @param flowId flow id
     * @return true if referenced
     */
    public boolean referencesAlternate(String flowId) {
        return steps.stream().anyMatch(step -> step.alternateFlowIds().contains(flowId));
    }
}
