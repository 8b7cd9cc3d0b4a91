package com.architekt.core.store;

import com.architekt.core.model.EntryPoint;
import com.architekt.core.util.Immutables;

import java.util.List;

/**
 * Fields supplied when creating or updating a component, including its full list of entry
 * points.
 *
 * <p>Entry points whose id is already owned by the component keep it; the others get new ids.
 * On update, owned entry points missing from the list are deleted.
 *
 * @param name component name
 * @param description optional description
 * @param entryPoints entry point drafts
 */
public record ComponentInput(String name, String description, List<EntryPoint> entryPoints) {

    /**
     * Compact constructor with defaults.
     */
    public ComponentInput {
        entryPoints = Immutables.list(entryPoints);
    }
}
