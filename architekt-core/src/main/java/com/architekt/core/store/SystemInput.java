package com.architekt.core.store;

import java.util.List;

/**
 * Fields supplied when creating or updating a system.
 *
 * @param name system name
 * @param description optional description
 * @param tags optional tags
 * @param parentId parent system id on creation; null places the system under the root.
 *                 Ignored on update.
 */
public record SystemInput(String name, String description, List<String> tags, String parentId) {

    public static SystemInput under(String parentId, String name) {
        return new SystemInput(name, null, null, parentId);
    }
}
