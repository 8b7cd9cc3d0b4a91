package com.architekt.core.flow;

import com.architekt.core.model.Component;
import com.architekt.core.model.Flow;
import com.architekt.core.model.Project;
import com.architekt.core.model.Step;
import com.architekt.core.model.StepEndpoint;
import com.architekt.core.util.Immutables;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates a flow draft against the systems, components and flows of its project.
 *
 * <p>All rules run and every error is collected. The validator never changes state; callers
 * must refuse to persist a draft whose result is not valid.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>The flow name is required.</li>
 *   <li>The scope is filtered to systems that still exist. An empty filtered scope and a
 *       scope that lost ids are both errors.</li>
 *   <li>Per step: name required and unique (trimmed, case-insensitive; both offending steps
 *       are flagged); source and target set and valid; alternate flows exist (the draft itself
 *       counts as existing) and do not include the draft's own id.</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FlowValidationResult result = new FlowValidator().validate(draft, project);
 * if (!result.isValid()) {
 *     throw ValidationException.forFlow(result);
 * }
 * }</pre>
 */
public class FlowValidator {

    /**
     * Validates a draft.
     *
     * @param draft flow draft; its id is null for a flow that was never saved
     * @param project project the flow belongs to
     * @return validation result
     */
    public FlowValidationResult validate(Flow draft, Project project) {
        Objects.requireNonNull(draft, "draft must not be null");
        Objects.requireNonNull(project, "project must not be null");

        List<String> flowErrors = new ArrayList<>();
        Map<Integer, List<String>> stepErrors = new LinkedHashMap<>();

        if (Immutables.isBlank(draft.name())) {
            flowErrors.add("Flow name is required.");
        }

        Set<String> scope = new HashSet<>();
        for (String systemId : draft.systemScopeIds()) {
            if (project.systems().containsKey(systemId)) {
                scope.add(systemId);
            }
        }
        if (scope.isEmpty()) {
            flowErrors.add("Select at least one system for the flow scope.");
        }
        if (scope.size() != draft.systemScopeIds().size()) {
            flowErrors.add("Some scoped systems are no longer available in the project.");
        }

        Set<String> flowIds = new HashSet<>(project.flows().keySet());
        if (draft.id() != null) {
            flowIds.add(draft.id());
        }

        Map<String, Integer> firstIndexByName = new HashMap<>();
        List<Step> steps = draft.steps();
        for (int index = 0; index < steps.size(); index++) {
            Step step = steps.get(index);
            List<String> errors = stepErrors.computeIfAbsent(index, key -> new ArrayList<>());

            String normalizedName = step.name() == null ? "" : step.name().trim().toLowerCase(Locale.ROOT);
            if (normalizedName.isEmpty()) {
                errors.add("Step name is required.");
            } else {
                Integer firstIndex = firstIndexByName.putIfAbsent(normalizedName, index);
                if (firstIndex != null) {
                    stepErrors.get(firstIndex).add("Step name must be unique.");
                    errors.add("Step name must be unique.");
                }
            }

            validateEndpoint(step.source(), "Source", scope, project, errors);
            validateEndpoint(step.target(), "Target", scope, project, errors);

            boolean unknownAlternate = step.alternateFlowIds().stream().anyMatch(id -> !flowIds.contains(id));
            if (unknownAlternate) {
                errors.add("Alternate flows must exist within the project.");
            }
            if (draft.id() != null && step.alternateFlowIds().contains(draft.id())) {
                errors.add("A flow cannot reference itself as an alternate path.");
            }
        }

        return FlowValidationResult.of(flowErrors, stepErrors);
    }

    private void validateEndpoint(StepEndpoint endpoint, String role, Set<String> scope,
                                  Project project, List<String> errors) {
        if (endpoint == null) {
            errors.add("Select a " + role.toLowerCase(Locale.ROOT) + " system.");
            return;
        }
        if (endpoint instanceof StepEndpoint.SystemRef systemRef) {
            if (Immutables.isBlank(systemRef.systemId())) {
                errors.add("Select a " + role.toLowerCase(Locale.ROOT) + " system.");
            } else if (!scope.contains(systemRef.systemId())) {
                errors.add(role + " system must be part of the flow scope.");
            }
        } else if (endpoint instanceof StepEndpoint.EntryPointRef entryPointRef) {
            Component component = entryPointRef.componentId() == null
                ? null
                : project.components().get(entryPointRef.componentId());
            if (component == null) {
                errors.add(role + " component must exist within the project.");
            } else if (entryPointRef.entryPointId() != null
                && !component.entryPointIds().contains(entryPointRef.entryPointId())) {
                errors.add(role + " entry point must belong to the selected component.");
            }
        }
    }
}
