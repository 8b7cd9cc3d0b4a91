package com.architekt.core.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of {@link FlowValidator#validate}.
 *
 * @param flowErrors errors about the flow as a whole
 * @param stepErrors errors per step, keyed by step index; only failing steps are present
 * @param isValid true when there are no flow or step errors
 */
public record FlowValidationResult(
    List<String> flowErrors,
    Map<Integer, List<String>> stepErrors,
    boolean isValid
) {
    /**
     * Compact constructor copying the error collections.
     */
    public FlowValidationResult {
        flowErrors = flowErrors == null ? List.of() : List.copyOf(flowErrors);
        Map<Integer, List<String>> copy = new TreeMap<>();
        if (stepErrors != null) {
            stepErrors.forEach((index, errors) -> {
                if (errors != null && !errors.isEmpty()) {
                    copy.put(index, List.copyOf(errors));
                }
            });
        }
        stepErrors = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a result, deriving validity from the errors.
     *
     * @param flowErrors flow-level errors
     * @param stepErrors step-level errors
     * @return validation result
     */
    public static FlowValidationResult of(List<String> flowErrors, Map<Integer, List<String>> stepErrors) {
        boolean valid = flowErrors.isEmpty() && stepErrors.values().stream().allMatch(List::isEmpty);
        return new FlowValidationResult(flowErrors, stepErrors, valid);
    }

    /**
     * Returns the errors of one step.
     *
     * @param index step index
     * @return errors, empty when the step is valid
     */
    public List<String> errorsForStep(int index) {
        return stepErrors.getOrDefault(index, List.of());
    }

    /**
     * Flattens all errors into messages, prefixing step errors with their 1-based position.
     *
     * @return every message
     */
    public List<String> allMessages() {
        List<String> messages = new ArrayList<>(flowErrors);
        stepErrors.forEach((index, errors) ->
            errors.forEach(error -> messages.add("Step " + (index + 1) + ": " + error)));
        return messages;
    }
}
