package io.github.cyfko.querier.core.model;

/**
 * Wire names and default values of the query parameter model.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class QuerierConstants {

    private QuerierConstants() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    public static final String FREE_TEXT_KEY = "q";
    public static final String SORT_KEY = "sort";
    public static final String INCLUDE_KEY = "include";
    public static final String FIELDS_KEY = "fields";
    public static final String PAGE_KEY = "page";
    public static final String PAGE_SIZE_KEY = "pageSize";

    /** Prefix of filter keys: {@code filter[field]} or {@code filter[field][operator]}. */
    public static final String FILTER_PREFIX = "filter[";

    /** Operator assumed by {@code filter[field]=value}. */
    public static final String DEFAULT_OPERATOR = "eq";

    /** Literal standing for "no value" in {@code eq}/{@code neq} filters. */
    public static final String NULL_LITERAL = "null";

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 20;

    public static final String LIST_SEPARATOR = ",";
    public static final String DESCENDING_PREFIX = "-";
}
