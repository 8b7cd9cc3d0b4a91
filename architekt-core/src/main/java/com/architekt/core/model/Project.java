package com.architekt.core.model;

import com.architekt.core.util.Immutables;
import com.architekt.core.util.Tags;

import java.util.List;
import java.util.Map;

/**
 * The project aggregate: a system hierarchy plus the flows, data models, components and
 * entry points that describe it.
 *
 * <p>The project exclusively owns every collection; nothing is shared across projects. The
 * record is immutable, so a mutation builds a new project and the loaded value is never
 * changed in place.
 *
 * @param id unique identifier
 * @param name project name
 * @param description optional description
 * @param tags normalized tags
 * @param sharedWith user ids the project is shared with (stored only)
 * @param rootSystemId id of the root system
 * @param systems systems by id
 * @param flows flows by id
 * @param dataModels data models by id
 * @param components components by id
 * @param entryPoints entry points by id, each owned by exactly one component
 */
public record Project(
    String id,
    String name,
    String description,
    List<String> tags,
    List<String> sharedWith,
    String rootSystemId,
    Map<String, SystemNode> systems,
    Map<String, Flow> flows,
    Map<String, DataModel> dataModels,
    Map<String, Component> components,
    Map<String, EntryPoint> entryPoints
) {
    /**
     * Compact constructor with defaults.
     */
    public Project {
        tags = Tags.normalize(tags);
        sharedWith = Tags.normalize(sharedWith);
        systems = Immutables.orderedMap(systems);
        flows = Immutables.orderedMap(flows);
        dataModels = Immutables.orderedMap(dataModels);
        components = Immutables.orderedMap(components);
        entryPoints = Immutables.orderedMap(entryPoints);
    }

    /**
     * Creates a project holding only its root system.
     *
     * @param id project id
     * @param name project name
     * @param description optional description
     * @param tags tags
     * @param root root system
     * @return new project
     */
    public static Project withRoot(String id, String name, String description, List<String> tags, SystemNode root) {
        return new Project(id, name, description, tags, List.of(), root.id(),
            Map.of(root.id(), root), Map.of(), Map.of(), Map.of(), Map.of());
    }

    public Project withDetails(String newName, String newDescription, List<String> newTags) {
        return new Project(id, newName, newDescription, newTags, sharedWith, rootSystemId,
            systems, flows, dataModels, components, entryPoints);
    }

    public Project withSystems(Map<String, SystemNode> newSystems) {
        return new Project(id, name, description, tags, sharedWith, rootSystemId,
            newSystems, flows, dataModels, components, entryPoints);
    }

    public Project withFlows(Map<String, Flow> newFlows) {
        return new Project(id, name, description, tags, sharedWith, rootSystemId,
            systems, newFlows, dataModels, components, entryPoints);
    }

    public Project withDataModels(Map<String, DataModel> newDataModels) {
        return new Project(id, name, description, tags, sharedWith, rootSystemId,
            systems, flows, newDataModels, components, entryPoints);
    }

    public Project withComponents(Map<String, Component> newComponents, Map<String, EntryPoint> newEntryPoints) {
        return new Project(id, name, description, tags, sharedWith, rootSystemId,
            systems, flows, dataModels, newComponents, newEntryPoints);
    }

    public Project withEntryPoints(Map<String, EntryPoint> newEntryPoints) {
        return new Project(id, name, description, tags, sharedWith, rootSystemId,
            systems, flows, dataModels, components, newEntryPoints);
    }

    /**
     * Returns the root system.
     *
     * @return root system, or null if the aggregate is malformed
     */
    public SystemNode rootSystem() {
        return systems.get(rootSystemId);
    }
}
