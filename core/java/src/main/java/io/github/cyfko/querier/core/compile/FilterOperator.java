package io.github.cyfko.querier.core.compile;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Operators accepted in {@code filter[field][operator]} keys.
 * <p>
 * Operator names are matched after lower-casing; {@code ne} is an alias of {@code neq}.
 * </p>
 *
 * <table border="1">
 *   <caption>Operators</caption>
 *   <tr><th>Name</th><th>Meaning</th></tr>
 *   <tr><td>eq</td><td>equality, {@code null} means "is null"</td></tr>
 *   <tr><td>neq, ne</td><td>inequality, {@code null} means "is not null"</td></tr>
 *   <tr><td>notnull</td><td>presence test, value ignored</td></tr>
 *   <tr><td>gt, gte, lt, lte</td><td>ordering, comparable fields only</td></tr>
 *   <tr><td>in</td><td>comma-separated values, OR of equalities</td></tr>
 *   <tr><td>contains, startswith, endswith</td><td>substring match</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 */
public enum FilterOperator {
    EQ("eq"),
    NEQ("neq"),
    NOT_NULL("notnull"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    IN("in"),
    CONTAINS("contains"),
    STARTS_WITH("startswith"),
    ENDS_WITH("endswith");

    private static final Map<String, FilterOperator> BY_NAME = Map.ofEntries(
            Map.entry("eq", EQ),
            Map.entry("neq", NEQ),
            Map.entry("ne", NEQ),
            Map.entry("notnull", NOT_NULL),
            Map.entry("gt", GT),
            Map.entry("gte", GTE),
            Map.entry("lt", LT),
            Map.entry("lte", LTE),
            Map.entry("in", IN),
            Map.entry("contains", CONTAINS),
            Map.entry("startswith", STARTS_WITH),
            Map.entry("endswith", ENDS_WITH)
    );

    private final String wireName;

    FilterOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves an operator from its wire name.
     *
     * @param name operator name as sent by the client
     * @return the operator, or empty when the name is unknown
     */
    public static Optional<FilterOperator> fromString(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}
