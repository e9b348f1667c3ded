package io.github.cyfko.querier.core.model;

import java.util.*;

/**
 * Immutable, untyped query parameters of one search request.
 * <p>
 * Values are kept exactly as sent by the client; interpretation is deferred to the compilers,
 * which only act on names declared in a {@link io.github.cyfko.querier.core.api.FieldRegistry}.
 * </p>
 *
 * <h2>Wire shape</h2>
 * <pre>
 * ?q=acme&amp;filter[status][eq]=active&amp;filter[revenue][gte]=1000
 *  &amp;sort=-createdAt,name&amp;include=settings&amp;page=2&amp;pageSize=50
 * </pre>
 *
 * <p>Filter maps (outer and inner) are case-insensitive. Collections are deep unmodifiable copies.</p>
 *
 * @param freeText unstructured search term, may be null
 * @param filters  field name to (operator to raw value)
 * @param sort     comma-separated keys, {@code -} prefix for descending; may be null
 * @param include  comma-separated eager-load hints; may be null
 * @param fields   sparse field-selection hints, sorted case-insensitively
 * @param page     1-based page number as requested
 * @param pageSize requested page size
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record QuerierParams(
        String freeText,
        Map<String, Map<String, String>> filters,
        String sort,
        String include,
        SortedSet<String> fields,
        int page,
        int pageSize
) {

    public QuerierParams {
        filters = copyFilters(filters);
        fields = copyFields(fields);
    }

    /**
     * @return parameters with no filter and default paging
     */
    public static QuerierParams empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with these parameters
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .freeText(freeText)
                .sort(sort)
                .include(include)
                .page(page)
                .pageSize(pageSize);
        filters.forEach((field, ops) -> ops.forEach((op, value) -> builder.filter(field, op, value)));
        fields.forEach(builder::field);
        return builder;
    }

    private static Map<String, Map<String, String>> copyFilters(Map<String, Map<String, String>> source) {
        Map<String, Map<String, String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (source != null) {
            source.forEach((field, ops) -> {
                if (field == null || ops == null) {
                    return;
                }
                Map<String, String> opsCopy = copy.computeIfAbsent(field, k -> new TreeMap<>(String.CASE_INSENSITIVE_ORDER));
                ops.forEach((op, value) -> {
                    if (op != null) {
                        opsCopy.put(op, value);
                    }
                });
            });
        }
        copy.replaceAll((field, ops) -> Collections.unmodifiableMap(ops));
        return Collections.unmodifiableMap(copy);
    }

    private static SortedSet<String> copyFields(Collection<String> source) {
        SortedSet<String> copy = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (source != null) {
            for (String field : source) {
                if (field != null && !field.isBlank()) {
                    copy.add(field.trim());
                }
            }
        }
        return Collections.unmodifiableSortedSet(copy);
    }

    /**
     * Fluent builder for {@link QuerierParams}.
     */
    public static final class Builder {
        private String freeText;
        private final Map<String, Map<String, String>> filters = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private String sort;
        private String include;
        private final SortedSet<String> fields = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        private int page = QuerierConstants.DEFAULT_PAGE;
        private int pageSize = QuerierConstants.DEFAULT_PAGE_SIZE;

        private Builder() {
        }

        public Builder freeText(String freeText) {
            this.freeText = freeText;
            return this;
        }

        /**
         * Adds an {@code eq} filter.
         */
        public Builder filter(String field, String value) {
            return filter(field, QuerierConstants.DEFAULT_OPERATOR, value);
        }

        public Builder filter(String field, String operator, String value) {
            Objects.requireNonNull(field, "field cannot be null");
            Objects.requireNonNull(operator, "operator cannot be null");
            filters.computeIfAbsent(field, k -> new TreeMap<>(String.CASE_INSENSITIVE_ORDER)).put(operator, value);
            return this;
        }

        public Builder sort(String sort) {
            this.sort = sort;
            return this;
        }

        public Builder include(String include) {
            this.include = include;
            return this;
        }

        public Builder field(String field) {
            if (field != null && !field.isBlank()) {
                fields.add(field.trim());
            }
            return this;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public QuerierParams build() {
            return new QuerierParams(freeText, filters, sort, include, fields, page, pageSize);
        }
    }
}
