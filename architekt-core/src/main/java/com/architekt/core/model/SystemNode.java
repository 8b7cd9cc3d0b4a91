package com.architekt.core.model;

import com.architekt.core.util.Tags;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A node of a project's system hierarchy.
 *
 * <p>Exactly one system per project is the root. Every other system is reachable from the
 * root through {@code childIds} and has exactly one parent.
 *
 * @param id unique identifier
 * @param name system name
 * @param description optional description
 * @param tags normalized tags
 * @param childIds ordered ids of the direct children
 * @param isRoot whether this is the project's root system
 */
public record SystemNode(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("childIds") List<String> childIds,
    @JsonProperty("isRoot") boolean isRoot
) {
    /**
     * Compact constructor with defaults.
     */
    public SystemNode {
        tags = Tags.normalize(tags);
        childIds = Tags.normalize(childIds);
    }

    /**
     * Creates a childless, non-root system.
     *
     * @param id system id
     * @param name system name
     * @param description optional description
     * @param tags tags
     * @return new leaf system
     */
    public static SystemNode leaf(String id, String name, String description, List<String> tags) {
        return new SystemNode(id, name, description, tags, List.of(), false);
    }

    /**
     * Creates the root system of a new project.
     *
     * @param id system id
     * @param name system name (the project name)
     * @param description optional description
     * @return new root system
     */
    public static SystemNode root(String id, String name, String description) {
        return new SystemNode(id, name, description, List.of(), List.of(), true);
    }

    public SystemNode withChildIds(List<String> newChildIds) {
        return new SystemNode(id, name, description, tags, newChildIds, isRoot);
    }

    public SystemNode withDetails(String newName, String newDescription, List<String> newTags) {
        return new SystemNode(id, newName, newDescription, newTags, childIds, isRoot);
    }

    /**
     * Checks whether this system lists the given id as a direct child.
     *
     * @param systemId candidate child id
     * @return true when the id is a direct child
     */
    public boolean hasChild(String systemId) {
        return childIds.contains(systemId);
    }
}
