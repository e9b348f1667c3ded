package io.github.cyfko.querier.core.exception;

/**
 * Exception thrown when a filter value cannot be parsed and the configured
 * {@link io.github.cyfko.querier.core.config.ParseFailurePolicy} is
 * {@link io.github.cyfko.querier.core.config.ParseFailurePolicy#REJECT_REQUEST REJECT_REQUEST}.
 * <p>
 * This is a client error (400-class). The exception carries the external field name, the
 * operator and the raw value so that the calling layer can build a precise error response.
 * </p>
 *
 * <pre>{@code
 * try {
 *     builder.executeAsync().join();
 * } catch (QuerierValidationException e) {
 *     return ResponseEntity.badRequest().body(e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class QuerierValidationException extends RuntimeException {

    private final String field;
    private final String operator;
    private final String rawValue;

    /**
     * Creates an exception describing the rejected clause.
     *
     * @param field    external field name as sent by the client
     * @param operator normalized operator name
     * @param rawValue raw value that failed to parse
     * @param message  the description of the failure
     */
    public QuerierValidationException(String field, String operator, String rawValue, String message) {
        super(message);
        this.field = field;
        this.operator = operator;
        this.rawValue = rawValue;
    }

    public String getField() {
        return field;
    }

    public String getOperator() {
        return operator;
    }

    public String getRawValue() {
        return rawValue;
    }
}
