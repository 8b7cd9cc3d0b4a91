package com.architekt.core.component;

import com.architekt.core.attribute.AttributeSchemaValidator;
import com.architekt.core.model.EntryPoint;
import com.architekt.core.model.Project;
import com.architekt.core.util.Immutables;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collects the problems of an entry point draft.
 */
public final class EntryPointValidator {

    private EntryPointValidator() {
        // Utility class
    }

    /**
     * Validates an entry point against its project.
     *
     * @param entryPoint entry point draft
     * @param project owning project, used to resolve data model references
     * @return every problem found, empty when valid
     */
    public static List<String> validate(EntryPoint entryPoint, Project project) {
        List<String> errors = new ArrayList<>();

        if (Immutables.isBlank(entryPoint.name())) {
            errors.add("Entry point name is required.");
        }

        if (Immutables.isBlank(entryPoint.type())) {
            errors.add("Entry point type is required.");
        } else {
            Optional<EntryPointType> type = EntryPointType.fromId(entryPoint.type());
            if (type.isEmpty()) {
                errors.add("Unknown entry point type: " + entryPoint.type());
            } else {
                validateTransport(entryPoint, type.get(), errors);
            }
        }

        for (String modelId : entryPoint.requestModelIds()) {
            if (!project.dataModels().containsKey(modelId)) {
                errors.add("Request data model does not exist: " + modelId);
            }
        }
        for (String modelId : entryPoint.responseModelIds()) {
            if (!project.dataModels().containsKey(modelId)) {
                errors.add("Response data model does not exist: " + modelId);
            }
        }

        AttributeSchemaValidator.validate(entryPoint.requestAttributes())
            .forEach(error -> errors.add("Request " + error));
        AttributeSchemaValidator.validate(entryPoint.responseAttributes())
            .forEach(error -> errors.add("Response " + error));
        return errors;
    }

    private static void validateTransport(EntryPoint entryPoint, EntryPointType type, List<String> errors) {
        if (!Immutables.isBlank(entryPoint.protocol()) && !type.allowsProtocol(entryPoint.protocol())) {
            errors.add(type.allowedProtocols().isEmpty()
                ? "Protocol does not apply to " + type.id() + " entry points."
                : "Protocol " + entryPoint.protocol() + " is not allowed for " + type.id() + " entry points.");
        }
        if (!Immutables.isBlank(entryPoint.method()) && !type.allowsMethod(entryPoint.method())) {
            errors.add(type.allowedMethods().isEmpty()
                ? "Method does not apply to " + type.id() + " entry points."
                : "Method " + entryPoint.method() + " is not allowed for " + type.id() + " entry points.");
        }
    }
}
