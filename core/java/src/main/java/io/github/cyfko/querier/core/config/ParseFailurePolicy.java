package io.github.cyfko.querier.core.config;

/**
 * Policies for handling filter values that cannot be parsed into the type of the targeted field.
 * <p>
 * Only value parsing is governed by this policy. Unregistered fields, unknown operators and
 * unregistered include hints are always ignored.
 * </p>
 *
 * @author Frank KOSSI
 */
public enum ParseFailurePolicy {
    /** Drop the offending clause and run the query with the remaining ones. */
    IGNORE_CLAUSE,
    /** Reject the whole request with a {@link io.github.cyfko.querier.core.exception.QuerierValidationException}. */
    REJECT_REQUEST
}
