package com.architekt.core.model;

import com.architekt.core.util.IdGenerator;
import com.architekt.core.util.Immutables;

import java.util.List;

/**
 * Recursive schema node used by data models and entry point request/response shapes.
 *
 * <p>{@code localId} addresses a node while a schema is being edited; it is always set.
 * {@code id} is minted on first persist and is null on unsaved drafts. A draft built from a
 * persisted attribute reuses its id as local id.
 *
 * <p>Children in {@code attributes} are only meaningful for {@link AttributeType#OBJECT};
 * {@code element} is only meaningful for {@link AttributeType#ARRAY}.
 *
 * @param id persisted identifier, null until first saved
 * @param localId identifier used for edits within one draft
 * @param name attribute name
 * @param description optional description
 * @param type value type, null while a draft is incomplete
 * @param constraints constraints, at most one per kind
 * @param flags boolean markers
 * @param attributes child attributes of an object
 * @param element element definition of an array
 */
public record Attribute(
    String id,
    String localId,
    String name,
    String description,
    AttributeType type,
    List<Constraint> constraints,
    AttributeFlags flags,
    List<Attribute> attributes,
    Attribute element
) {
    /**
     * Compact constructor with defaults.
     */
    public Attribute {
        if (localId == null || localId.isBlank()) {
            localId = IdGenerator.orNew(id);
        }
        constraints = Immutables.list(constraints);
        if (flags == null) {
            flags = AttributeFlags.none();
        }
        attributes = Immutables.list(attributes);
    }

    /**
     * Creates an unsaved attribute with no constraints, flags or children.
     *
     * @param name attribute name
     * @param type value type
     * @return new draft attribute with a fresh local id
     */
    public static Attribute draft(String name, AttributeType type) {
        return new Attribute(null, null, name, null, type, List.of(), AttributeFlags.none(), List.of(), null);
    }

    public Attribute withId(String newId) {
        return new Attribute(newId, localId, name, description, type, constraints, flags, attributes, element);
    }

    public Attribute withLocalId(String newLocalId) {
        return new Attribute(id, newLocalId, name, description, type, constraints, flags, attributes, element);
    }

    public Attribute withName(String newName) {
        return new Attribute(id, localId, newName, description, type, constraints, flags, attributes, element);
    }

    public Attribute withType(AttributeType newType) {
        return new Attribute(id, localId, name, description, newType, constraints, flags, attributes, element);
    }

    public Attribute withConstraints(List<Constraint> newConstraints) {
        return new Attribute(id, localId, name, description, type, newConstraints, flags, attributes, element);
    }

    public Attribute withAttributes(List<Attribute> newAttributes) {
        return new Attribute(id, localId, name, description, type, constraints, flags, newAttributes, element);
    }

    public Attribute withElement(Attribute newElement) {
        return new Attribute(id, localId, name, description, type, constraints, flags, attributes, newElement);
    }
}
