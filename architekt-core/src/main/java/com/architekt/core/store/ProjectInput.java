package com.architekt.core.store;

import java.util.List;

/**
 * Fields supplied when creating or updating a project.
 *
 * <p>On update, a blank name and null description or tags keep the previous values.
 *
 * @param name project name
 * @param description optional description
 * @param tags optional tags
 */
public record ProjectInput(String name, String description, List<String> tags) {

    public static ProjectInput named(String name) {
        return new ProjectInput(name, null, null);
    }
}
