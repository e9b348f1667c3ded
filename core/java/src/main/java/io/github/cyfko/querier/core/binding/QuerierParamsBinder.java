package io.github.cyfko.querier.core.binding;

import io.github.cyfko.querier.core.model.QuerierConstants;
import io.github.cyfko.querier.core.model.QuerierParams;

import java.util.*;
import java.util.logging.Logger;

/**
 * Binds raw multi-valued request parameters into {@link QuerierParams}.
 *
 * <h2>Recognized keys</h2>
 * <ul>
 *   <li>{@code q}, {@code sort}, {@code include}, {@code fields}</li>
 *   <li>{@code page}, {@code pageSize}: unparsable values fall back to 1 and 20</li>
 *   <li>{@code filter[field]}: {@code eq} filter</li>
 *   <li>{@code filter[field][operator]}: filter with an explicit operator</li>
 * </ul>
 * <p>
 * Any other shape after the field name ({@code filter[a]x}, {@code filter[a][]}, {@code filter[]})
 * is malformed and skipped. Filters are added sorted by field, then operator, ignoring case.
 * Several values under one key are joined with {@code ","}.
 * </p>
 *
 * <pre>{@code
 * QuerierParams params = new QuerierParamsBinder().bind(request.getParameterMap());
 * }</pre>
 *
 * @author Frank KOSSI
 */
public class QuerierParamsBinder {

    private static final Logger logger = Logger.getLogger(QuerierParamsBinder.class.getName());

    private final int defaultPageSize;

    public QuerierParamsBinder() {
        this(QuerierConstants.DEFAULT_PAGE_SIZE);
    }

    /**
     * @param defaultPageSize page size used when the request carries none or an unparsable one
     */
    public QuerierParamsBinder(int defaultPageSize) {
        if (defaultPageSize < 1) {
            throw new IllegalArgumentException("Default page size must be positive. Provided: " + defaultPageSize);
        }
        this.defaultPageSize = defaultPageSize;
    }

    /**
     * Binds a servlet-style parameter map.
     *
     * @param parameters parameter name to values
     * @return the bound parameters
     */
    public QuerierParams bind(Map<String, String[]> parameters) {
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        if (parameters != null) {
            parameters.forEach((key, values) ->
                    normalized.put(key, values == null ? List.of() : Arrays.asList(values)));
        }
        return bindValues(normalized);
    }

    /**
     * Binds a multi-value map ({@code MultiValueMap}, {@code Map<String, List<String>>}, ...).
     *
     * @param parameters parameter name to values
     * @return the bound parameters
     */
    public QuerierParams bindValues(Map<String, ? extends Collection<String>> parameters) {
        Map<String, String> joined = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        List<FilterEntry> filters = new ArrayList<>();

        if (parameters != null) {
            parameters.forEach((key, values) -> {
                if (key == null) {
                    return;
                }
                String value = join(values);
                if (key.startsWith(QuerierConstants.FILTER_PREFIX)) {
                    parseFilterKey(key, value).ifPresentOrElse(filters::add,
                            () -> logger.fine(() -> "Skipping malformed filter key '" + key + "'"));
                } else {
                    joined.put(key, value);
                }
            });
        }

        filters.sort(Comparator.comparing(FilterEntry::field, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(FilterEntry::operator, String.CASE_INSENSITIVE_ORDER));

        QuerierParams.Builder builder = QuerierParams.builder()
                .freeText(joined.get(QuerierConstants.FREE_TEXT_KEY))
                .sort(joined.get(QuerierConstants.SORT_KEY))
                .include(joined.get(QuerierConstants.INCLUDE_KEY))
                .page(parseInt(joined.get(QuerierConstants.PAGE_KEY), QuerierConstants.DEFAULT_PAGE))
                .pageSize(parseInt(joined.get(QuerierConstants.PAGE_SIZE_KEY), defaultPageSize));

        String fields = joined.get(QuerierConstants.FIELDS_KEY);
        if (fields != null) {
            for (String field : fields.split(QuerierConstants.LIST_SEPARATOR)) {
                builder.field(field);
            }
        }

        for (FilterEntry entry : filters) {
            builder.filter(entry.field(), entry.operator(), entry.value());
        }
        return builder.build();
    }

    /**
     * Parses {@code filter[field]} or {@code filter[field][operator]}.
     */
    static Optional<FilterEntry> parseFilterKey(String key, String value) {
        String rest = key.substring(QuerierConstants.FILTER_PREFIX.length());
        int closing = rest.indexOf(']');
        if (closing <= 0) {
            return Optional.empty();
        }

        String field = rest.substring(0, closing);
        String remainder = rest.substring(closing + 1);
        String operator = QuerierConstants.DEFAULT_OPERATOR;

        if (!remainder.isEmpty()) {
            if (remainder.length() > 2 && remainder.charAt(0) == '[' && remainder.charAt(remainder.length() - 1) == ']') {
                operator = remainder.substring(1, remainder.length() - 1);
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(new FilterEntry(field, operator, value));
    }

    private static String join(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        List<String> present = values.stream().filter(Objects::nonNull).toList();
        return present.isEmpty() ? null : String.join(QuerierConstants.LIST_SEPARATOR, present);
    }

    private static int parseInt(String raw, int defaultValue) {
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    record FilterEntry(String field, String operator, String value) {
    }
}
