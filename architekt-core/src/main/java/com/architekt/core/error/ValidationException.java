package com.architekt.core.error;

import com.architekt.core.flow.FlowValidationResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Raised when a mutation would leave the project aggregate in an invalid state.
 *
 * <p>Simple field checks produce a single message. Collected checks (flow validation,
 * attribute schemas, entry points) produce one exception carrying every message, so a
 * caller can surface all problems at once.
 */
public class ValidationException extends ArchitektException {

    private final List<String> errors;
    private final FlowValidationResult flowResult;

    public ValidationException(List<String> errors) {
        this(errors, null);
    }

    private ValidationException(List<String> errors, FlowValidationResult flowResult) {
        super(String.join(" ", requireErrors(errors)));
        this.errors = List.copyOf(errors);
        this.flowResult = flowResult;
    }

    /**
     * Creates a fail-fast validation error with a single message.
     *
     * @param message error message
     * @return validation exception
     */
    public static ValidationException of(String message) {
        return new ValidationException(List.of(message));
    }

    /**
     * Creates a validation error from a failed flow validation.
     *
     * @param result validation result with {@code isValid() == false}
     * @return validation exception carrying the structured result
     */
    public static ValidationException forFlow(FlowValidationResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return new ValidationException(result.allMessages(), result);
    }

    public List<String> errors() {
        return errors;
    }

    /**
     * Returns the structured flow result when this error came from flow validation.
     *
     * @return flow validation result, empty for other validation errors
     */
    public Optional<FlowValidationResult> flowResult() {
        return Optional.ofNullable(flowResult);
    }

    @Override
    public int httpStatus() {
        return 400;
    }

    private static List<String> requireErrors(List<String> errors) {
        Objects.requireNonNull(errors, "errors must not be null");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("At least one validation error required");
        }
        return errors;
    }
}
