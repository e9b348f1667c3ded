package io.github.cyfko.querier.core;

import io.github.cyfko.querier.core.utils.ValidationResult;

/**
 * Lifecycle of a {@link QuerierBuilder}.
 * <pre>
 * UNCONFIGURED --(all required pieces set)--&gt; CONFIGURED --(executeAsync)--&gt; EXECUTED
 * </pre>
 * {@code EXECUTED} is terminal.
 *
 * @author Frank KOSSI
 */
public enum BuilderState {
    UNCONFIGURED,
    CONFIGURED,
    EXECUTED;

    /**
     * Checks whether the builder may move from this state to {@code target}.
     *
     * @param target the requested state
     * @return success, or a failure describing the refused transition
     */
    public ValidationResult checkTransition(BuilderState target) {
        if (this == EXECUTED) {
            return ValidationResult.failure(
                    "This QuerierBuilder has already been executed. Create a new instance for additional searches.");
        }
        if (target == EXECUTED && this == UNCONFIGURED) {
            return ValidationResult.failure("Cannot execute an unconfigured QuerierBuilder");
        }
        return ValidationResult.success();
    }
}
