package io.github.cyfko.querier.core.utils;

/**
 * Class representing the result of a validation operation.
 * <p>
 * The result can indicate either a successful validation or a failure with an associated error message.
 * It is used where a check must report a failure without throwing, leaving the caller free to decide
 * which exception (if any) the failure maps to.
 * </p>
 *
 * <p>Instances are immutable and created via the static methods
 * {@link #success()} and {@link #failure(String)}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = state.checkTransition(BuilderState.EXECUTED);
 * if (!result.isValid()) {
 *     throw new QuerierStateException(result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null);

    private final boolean valid;
    private final String errorMessage;

    private ValidationResult(boolean valid, String errorMessage) {
        this.valid = valid;
        this.errorMessage = errorMessage;
    }

    /**
     * Creates an instance indicating a successful validation.
     *
     * @return a valid result with no error message
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * Creates an instance indicating a failed validation with an error message.
     *
     * @param errorMessage message explaining the reason for failure
     * @return an invalid result containing the provided error message
     */
    public static ValidationResult failure(String errorMessage) {
        return new ValidationResult(false, errorMessage);
    }

    /**
     * Indicates whether the validation succeeded.
     *
     * @return true if valid, false otherwise
     */
    public boolean isValid() {
        return valid;
    }

    /**
     * Returns the error message associated with a failed validation.
     *
     * @return error message if invalid, or null if valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, error=" + errorMessage + "]";
    }
}
