package io.github.cyfko.querier.core.exception;

/**
 * Exception thrown when a {@link io.github.cyfko.querier.core.api.FieldRegistry} is declared
 * inconsistently.
 * <p>
 * Raised at configuration time only, never while serving a request: blank or duplicated
 * external names, a canonical free-text or default-sort field that does not reference a
 * declared field, or a blank include name.
 * </p>
 *
 * <p><strong>Usage Examples:</strong></p>
 * <pre>{@code
 * // Duplicated external name
 * throw new FieldDefinitionException("Filterable field 'name' is already declared for Company");
 *
 * // Canonical field pointing nowhere
 * throw new FieldDefinitionException("Default sort field 'createdAt' is not a declared field of Company");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FieldDefinitionException extends RuntimeException {

    /**
     * Creates a new FieldDefinitionException with detailed message.
     *
     * @param message explanation of the declaration error
     */
    public FieldDefinitionException(String message) {
        super(message);
    }

    /**
     * Creates a new FieldDefinitionException with detailed message and cause.
     *
     * @param message explanation of the declaration error
     * @param cause underlying exception causing this failure
     */
    public FieldDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
