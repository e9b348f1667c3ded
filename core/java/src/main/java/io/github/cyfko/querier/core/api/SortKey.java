package io.github.cyfko.querier.core.api;

import java.util.Objects;

/**
 * One ordering key: an accessor and a direction.
 *
 * @param field      the sortable field
 * @param descending whether the order is reversed
 * @param <T>        entity type
 * @author Frank KOSSI
 */
public record SortKey<T>(FieldAccessor<T, ?> field, boolean descending) {

    public SortKey {
        Objects.requireNonNull(field, "field cannot be null");
    }

    public static <T> SortKey<T> asc(FieldAccessor<T, ?> field) {
        return new SortKey<>(field, false);
    }

    public static <T> SortKey<T> desc(FieldAccessor<T, ?> field) {
        return new SortKey<>(field, true);
    }
}
