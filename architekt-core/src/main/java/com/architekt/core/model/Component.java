package com.architekt.core.model;

import com.architekt.core.util.Tags;

import java.util.List;

/**
 * Deployable part of the architecture (service, function, worker).
 *
 * <p>A component exclusively owns its entry points, which live in
 * {@link Project#entryPoints()} and are referenced by id.
 *
 * @param id component id
 * @param name component name
 * @param description optional description
 * @param entryPointIds ids of the owned entry points
 */
public record Component(
    String id,
    String name,
    String description,
    List<String> entryPointIds
) {
    /**
     * Compact constructor with defaults.
     */
    public Component {
        entryPointIds = Tags.normalize(entryPointIds);
    }

    public Component withEntryPointIds(List<String> newEntryPointIds) {
        return new Component(id, name, description, newEntryPointIds);
    }
}
