package io.github.cyfko.querier.core.config;

/**
 * Mode used to compare raw filter values to enum constants.
 *
 * @author Frank KOSSI
 */
public enum EnumMatchMode {
    /** Match enum name exactly (case-sensitive). */
    CASE_SENSITIVE,
    /** Match enum ignoring case. */
    CASE_INSENSITIVE
}
