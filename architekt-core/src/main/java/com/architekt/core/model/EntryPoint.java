package com.architekt.core.model;

import com.architekt.core.util.Immutables;
import com.architekt.core.util.Tags;

import java.util.List;

/**
 * Way into a {@link Component}: an HTTP route, queue listener, scheduled job and so on.
 *
 * @param id entry point id, null on drafts
 * @param name entry point name
 * @param description optional description
 * @param type entry point type (e.g., "http", "queue", "cron")
 * @param functionName handler function name, mostly for serverless functions
 * @param protocol transport protocol
 * @param method protocol method or operation
 * @param path route, topic or queue name
 * @param requestModelIds data models accepted as input
 * @param responseModelIds data models produced as output
 * @param requestAttributes inline request schema
 * @param responseAttributes inline response schema
 */
public record EntryPoint(
    String id,
    String name,
    String description,
    String type,
    String functionName,
    String protocol,
    String method,
    String path,
    List<String> requestModelIds,
    List<String> responseModelIds,
    List<Attribute> requestAttributes,
    List<Attribute> responseAttributes
) {
    /**
     * Compact constructor with defaults.
     */
    public EntryPoint {
        requestModelIds = Tags.normalize(requestModelIds);
        responseModelIds = Tags.normalize(responseModelIds);
        requestAttributes = Immutables.list(requestAttributes);
        responseAttributes = Immutables.list(responseAttributes);
    }

    /**
     * Creates an unsaved entry point with only a name and type.
     *
     * @param name entry point name
     * @param type entry point type
     * @return new draft entry point
     */
    public static EntryPoint draft(String name, String type) {
        return new EntryPoint(null, name, null, type, null, null, null, null,
            List.of(), List.of(), List.of(), List.of());
    }

    public EntryPoint withId(String newId) {
        return new EntryPoint(newId, name, description, type, functionName, protocol, method, path,
            requestModelIds, responseModelIds, requestAttributes, responseAttributes);
    }

    public EntryPoint withModelIds(List<String> newRequestModelIds, List<String> newResponseModelIds) {
        return new EntryPoint(id, name, description, type, functionName, protocol, method, path,
            newRequestModelIds, newResponseModelIds, requestAttributes, responseAttributes);
    }

    public EntryPoint withAttributes(List<Attribute> newRequestAttributes, List<Attribute> newResponseAttributes) {
        return new EntryPoint(id, name, description, type, functionName, protocol, method, path,
            requestModelIds, responseModelIds, newRequestAttributes, newResponseAttributes);
    }
}
