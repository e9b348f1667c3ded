package io.github.cyfko.querier.core.api;

import io.github.cyfko.querier.core.utils.TypeConversionUtils;

import java.util.Objects;
import java.util.function.Function;

/**
 * Typed accessor to a single entity attribute.
 * <p>
 * An accessor binds a storage attribute path to its value type and to a getter usable for
 * in-memory evaluation. The path is declared by the entity owner and never derived from client
 * input; dot notation ({@code "address.city"}) designates a nested attribute.
 * </p>
 *
 * <pre>{@code
 * FieldAccessor<Company, String> name = FieldAccessor.of("name", String.class, Company::getName);
 * FieldAccessor<Company, String> city = FieldAccessor.of("address.city", String.class, c -> c.getAddress().getCity());
 * }</pre>
 *
 * <p>Primitive types are boxed on construction, so {@link #type()} is always a reference type.</p>
 *
 * @param path   storage attribute path
 * @param type   value type, boxed
 * @param getter getter used by in-memory sources
 * @param <T>    entity type
 * @param <V>    value type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FieldAccessor<T, V>(String path, Class<V> type, Function<? super T, ? extends V> getter) {

    @SuppressWarnings("unchecked")
    public FieldAccessor {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(getter, "getter cannot be null");
        if (path.isBlank()) {
            throw new IllegalArgumentException("path cannot be blank");
        }
        type = (Class<V>) TypeConversionUtils.box(type);
    }

    public static <T, V> FieldAccessor<T, V> of(String path, Class<V> type, Function<? super T, ? extends V> getter) {
        return new FieldAccessor<>(path, type, getter);
    }

    /**
     * Reads the attribute from an entity instance.
     *
     * @param entity the entity, may be null
     * @return the attribute value, or null when the entity is null
     */
    public V get(T entity) {
        return entity == null ? null : getter.apply(entity);
    }

    /**
     * @return true when values of this accessor support ordering comparisons
     */
    public boolean isComparable() {
        return Comparable.class.isAssignableFrom(type);
    }

    public boolean isText() {
        return type == String.class;
    }

    @Override
    public String toString() {
        return "FieldAccessor[" + path + ": " + type.getSimpleName() + "]";
    }
}
