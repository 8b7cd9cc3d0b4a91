package com.architekt.core.system;

import com.architekt.core.error.NotFoundException;
import com.architekt.core.error.ValidationException;
import com.architekt.core.model.Project;
import com.architekt.core.model.SystemNode;
import com.architekt.core.util.Immutables;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Structural operations on a project's system hierarchy.
 *
 * <p>Every operation works on whole subtrees and returns a new {@link Project}; the input
 * project is never modified. Connectivity of the tree is preserved by construction, so no
 * global re-validation runs after a mutation.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Project updated = SystemTree.add(project, project.rootSystemId(), SystemNode.leaf(id, "Billing", null, List.of()));
 * Project pruned = SystemTree.remove(updated, id);
 * }</pre>
 */
public final class SystemTree {

    private SystemTree() {
        // Utility class
    }

    /**
     * Adds a system under an existing parent.
     *
     * <p>The new system always starts as a childless non-root node. Its id is appended to the
     * parent's {@code childIds} unless already present.
     *
     * @param project project to modify
     * @param parentId id of the parent system
     * @param newSystem system to add
     * @return project containing the new system
     * @throws NotFoundException if the parent does not exist
     * @throws ValidationException if a system with the same id already exists
     */
    public static Project add(Project project, String parentId, SystemNode newSystem) {
        Objects.requireNonNull(project, "project must not be null");
        Objects.requireNonNull(newSystem, "newSystem must not be null");
        Objects.requireNonNull(newSystem.id(), "newSystem.id must not be null");

        SystemNode parent = parentId == null ? null : project.systems().get(parentId);
        if (parent == null) {
            throw new NotFoundException("System", parentId);
        }
        if (project.systems().containsKey(newSystem.id())) {
            throw ValidationException.of("System already exists: " + newSystem.id());
        }

        SystemNode child = new SystemNode(newSystem.id(), newSystem.name(), newSystem.description(),
            newSystem.tags(), List.of(), false);

        Map<String, SystemNode> systems = new LinkedHashMap<>(project.systems());
        if (!parent.hasChild(child.id())) {
            List<String> childIds = new ArrayList<>(parent.childIds());
            childIds.add(child.id());
            systems.put(parent.id(), parent.withChildIds(childIds));
        }
        systems.put(child.id(), child);
        return project.withSystems(systems);
    }

    /**
     * Removes a system together with all of its descendants.
     *
     * @param project project to modify
     * @param systemId id of the system to remove
     * @return project without the subtree
     * @throws NotFoundException if the system does not exist
     * @throws ValidationException if the system is the root
     */
    public static Project remove(Project project, String systemId) {
        Objects.requireNonNull(project, "project must not be null");

        SystemNode target = systemId == null ? null : project.systems().get(systemId);
        if (target == null) {
            throw new NotFoundException("System", systemId);
        }
        if (target.isRoot()) {
            throw ValidationException.of("Cannot delete the root system.");
        }

        Set<String> removed = collectSubtree(project, systemId);

        Map<String, SystemNode> systems = new LinkedHashMap<>(project.systems());
        findParentId(project, systemId).ifPresent(parentId -> {
            SystemNode parent = systems.get(parentId);
            List<String> childIds = new ArrayList<>(parent.childIds());
            childIds.remove(systemId);
            systems.put(parentId, parent.withChildIds(childIds));
        });
        return project.withSystems(Immutables.without(systems, removed));
    }

    /**
     * Collects a system and every transitive descendant.
     *
     * <p>Uses an explicit stack guarded by a visited set, so a malformed cyclic hierarchy
     * terminates.
     *
     * @param project project to inspect
     * @param systemId id of the subtree root
     * @return ids of the subtree, including {@code systemId}
     */
    public static Set<String> collectSubtree(Project project, String systemId) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(systemId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            SystemNode node = project.systems().get(current);
            if (node == null) {
                continue;
            }
            for (String childId : node.childIds()) {
                if (!visited.contains(childId)) {
                    stack.push(childId);
                }
            }
        }
        return visited;
    }

    /**
     * Finds the parent of a system by scanning every system's children.
     *
     * @param project project to inspect
     * @param systemId child id
     * @return parent id, empty for the root or a detached system
     */
    public static Optional<String> findParentId(Project project, String systemId) {
        return project.systems().values().stream()
            .filter(system -> system.hasChild(systemId))
            .map(SystemNode::id)
            .findFirst();
    }
}
