package com.architekt.core.model;

import com.architekt.core.util.Immutables;

import java.util.List;

/**
 * Named schema made of an attribute tree.
 *
 * @param id data model id, null on drafts
 * @param name data model name
 * @param description optional description
 * @param attributes top-level attributes
 */
public record DataModel(
    String id,
    String name,
    String description,
    List<Attribute> attributes
) {
    /**
     * Compact constructor with defaults.
     */
    public DataModel {
        attributes = Immutables.list(attributes);
    }

    public DataModel withId(String newId) {
        return new DataModel(newId, name, description, attributes);
    }

    public DataModel withAttributes(List<Attribute> newAttributes) {
        return new DataModel(id, name, description, newAttributes);
    }
}
