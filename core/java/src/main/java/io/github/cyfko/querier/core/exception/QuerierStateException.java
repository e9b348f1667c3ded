package io.github.cyfko.querier.core.exception;

/**
 * Exception thrown when a {@link io.github.cyfko.querier.core.QuerierBuilder} is used outside of
 * its allowed lifecycle.
 * <p>
 * This is a programming error rather than a client error: the builder was reconfigured or
 * re-executed after its single execution, or executed before its required collaborators
 * (source, parameters, field registry) were supplied. Callers should not retry with the same
 * builder; a new instance has to be created for every search.
 * </p>
 *
 * <p><strong>Typical messages:</strong></p>
 * <pre>{@code
 * // second execution
 * "This QuerierBuilder has already been executed. Create a new instance for additional searches."
 *
 * // missing configuration
 * "Cannot execute an unconfigured QuerierBuilder: missing source"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.querier.core.BuilderState
 */
public class QuerierStateException extends IllegalStateException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the lifecycle violation
     */
    public QuerierStateException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and an underlying cause.
     *
     * @param message the description of the lifecycle violation
     * @param cause   the original cause
     */
    public QuerierStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
