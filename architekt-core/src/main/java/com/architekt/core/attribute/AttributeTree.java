package com.architekt.core.attribute;

import com.architekt.core.error.NotFoundException;
import com.architekt.core.model.Attribute;
import com.architekt.core.util.IdGenerator;
import com.architekt.core.util.Immutables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Structural operations on a recursive attribute tree, addressed by local id.
 *
 * <p>Trees are immutable lists. Every operation returns a new tree in which only the nodes
 * on the path to the target are rebuilt; untouched siblings and subtrees keep their identity,
 * and an operation that changes nothing returns the input list itself.
 *
 * <p>Traversal covers both object children ({@link Attribute#attributes()}) and array
 * element definitions ({@link Attribute#element()}).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Attribute> tree = AttributeTree.add(List.of(), null, address);
 * tree = AttributeTree.add(tree, address.localId(), Attribute.draft("street", AttributeType.STRING));
 * tree = AttributeTree.remove(tree, address.localId());  // street is gone too
 * }</pre>
 */
public final class AttributeTree {

    private AttributeTree() {
        // Utility class
    }

    /**
     * Appends an attribute to the top level or to the children of an existing node.
     *
     * @param tree current tree
     * @param parentLocalId local id of the parent node, or null for the top level
     * @param newAttribute attribute to append
     * @return tree containing the new attribute
     * @throws NotFoundException if {@code parentLocalId} is not in the tree
     */
    public static List<Attribute> add(List<Attribute> tree, String parentLocalId, Attribute newAttribute) {
        Objects.requireNonNull(newAttribute, "newAttribute must not be null");
        if (parentLocalId == null) {
            return append(tree, newAttribute);
        }
        if (find(tree, parentLocalId).isEmpty()) {
            throw new NotFoundException("Attribute", parentLocalId);
        }
        return update(tree, parentLocalId, parent -> parent.withAttributes(append(parent.attributes(), newAttribute)));
    }

    /**
     * Removes a node and its entire subtree, wherever it sits in the tree.
     *
     * @param tree current tree
     * @param targetLocalId local id of the node to remove
     * @return tree without the node
     */
    public static List<Attribute> remove(List<Attribute> tree, String targetLocalId) {
        boolean changed = false;
        List<Attribute> result = new ArrayList<>(tree.size());
        for (Attribute attribute : tree) {
            if (attribute.localId().equals(targetLocalId)) {
                changed = true;
                continue;
            }
            Attribute pruned = prune(attribute, targetLocalId);
            changed |= pruned != attribute;
            result.add(pruned);
        }
        return changed ? Collections.unmodifiableList(result) : tree;
    }

    /**
     * Replaces exactly one node with the result of {@code updater}.
     *
     * @param tree current tree
     * @param targetLocalId local id of the node to replace
     * @param updater function producing the replacement
     * @return tree with the node replaced, or the input tree if no node matched
     */
    public static List<Attribute> update(List<Attribute> tree, String targetLocalId, UnaryOperator<Attribute> updater) {
        boolean changed = false;
        List<Attribute> result = new ArrayList<>(tree.size());
        for (Attribute attribute : tree) {
            Attribute replaced = updateNode(attribute, targetLocalId, updater);
            changed |= replaced != attribute;
            result.add(replaced);
        }
        return changed ? Collections.unmodifiableList(result) : tree;
    }

    /**
     * Depth-first search for a node.
     *
     * @param tree tree to search
     * @param targetLocalId local id to find
     * @return matching node, empty if absent
     */
    public static Optional<Attribute> find(List<Attribute> tree, String targetLocalId) {
        for (Attribute attribute : tree) {
            Optional<Attribute> found = findIn(attribute, targetLocalId);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Collects the local ids of a node and its whole subtree.
     *
     * <p>Call before {@link #remove} when state keyed by local id has to be reconciled.
     *
     * @param root subtree root
     * @return local ids in depth-first order
     */
    public static Set<String> collectLocalIds(Attribute root) {
        Set<String> ids = new LinkedHashSet<>();
        collect(root, ids);
        return ids;
    }

    /**
     * Mints persisted ids for every node lacking one and aligns local ids with them.
     *
     * <p>An id already taken by an earlier node in depth-first order is replaced by a new one,
     * so ids are unique across the whole tree.
     *
     * @param tree tree about to be persisted
     * @return tree where every node has {@code id == localId}
     */
    public static List<Attribute> assignIds(List<Attribute> tree) {
        return assignIds(tree, new HashSet<>());
    }

    private static List<Attribute> assignIds(List<Attribute> tree, Set<String> taken) {
        return tree.stream().map(attribute -> assignIds(attribute, taken)).toList();
    }

    private static Attribute assignIds(Attribute attribute, Set<String> taken) {
        String id = !Immutables.isBlank(attribute.id()) && taken.add(attribute.id()) ? attribute.id() : claimNew(taken);
        List<Attribute> children = assignIds(attribute.attributes(), taken);
        Attribute element = attribute.element() == null ? null : assignIds(attribute.element(), taken);
        return attribute.withId(id)
            .withLocalId(id)
            .withAttributes(children)
            .withElement(element);
    }

    private static String claimNew(Set<String> taken) {
        String id = IdGenerator.newId();
        taken.add(id);
        return id;
    }

    private static List<Attribute> append(List<Attribute> list, Attribute attribute) {
        List<Attribute> result = new ArrayList<>(list == null ? List.of() : list);
        result.add(attribute);
        return Collections.unmodifiableList(result);
    }

    private static Attribute prune(Attribute attribute, String targetLocalId) {
        List<Attribute> children = remove(attribute.attributes(), targetLocalId);
        Attribute element = attribute.element();
        if (element != null) {
            element = element.localId().equals(targetLocalId) ? null : prune(element, targetLocalId);
        }
        if (children == attribute.attributes() && element == attribute.element()) {
            return attribute;
        }
        return attribute.withAttributes(children).withElement(element);
    }

    private static Attribute updateNode(Attribute attribute, String targetLocalId, UnaryOperator<Attribute> updater) {
        if (attribute.localId().equals(targetLocalId)) {
            return Objects.requireNonNull(updater.apply(attribute), "updater must not return null");
        }
        List<Attribute> children = update(attribute.attributes(), targetLocalId, updater);
        Attribute element = attribute.element() == null
            ? null
            : updateNode(attribute.element(), targetLocalId, updater);
        if (children == attribute.attributes() && element == attribute.element()) {
            return attribute;
        }
        return attribute.withAttributes(children).withElement(element);
    }

    private static Optional<Attribute> findIn(Attribute attribute, String targetLocalId) {
        if (attribute.localId().equals(targetLocalId)) {
            return Optional.of(attribute);
        }
        Optional<Attribute> found = find(attribute.attributes(), targetLocalId);
        if (found.isPresent() || attribute.element() == null) {
            return found;
        }
        return findIn(attribute.element(), targetLocalId);
    }

    private static void collect(Attribute attribute, Set<String> ids) {
        ids.add(attribute.localId());
        attribute.attributes().forEach(child -> collect(child, ids));
        if (attribute.element() != null) {
            collect(attribute.element(), ids);
        }
    }
}
