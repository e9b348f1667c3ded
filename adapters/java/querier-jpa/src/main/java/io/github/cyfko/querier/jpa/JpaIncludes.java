package io.github.cyfko.querier.jpa;

import io.github.cyfko.querier.core.spi.IncludeApplier;

/**
 * {@link IncludeApplier} implementations for {@link JpaQuerySource}.
 *
 * @author Frank KOSSI
 */
public final class JpaIncludes {

    private JpaIncludes() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Turns every allowed include into a LEFT fetch join of the association of the same name.
     * Include names must therefore be association paths of the entity ({@code "settings"},
     * {@code "owner.address"}).
     *
     * @param <T> entity type
     * @return the applier
     * @throws IllegalArgumentException when applied to a source that is not a {@link JpaQuerySource}
     */
    public static <T> IncludeApplier<T> fetchJoins() {
        return (source, includes) -> {
            if (source instanceof JpaQuerySource<T> jpaSource) {
                return jpaSource.withFetches(includes);
            }
            throw new IllegalArgumentException("Fetch-join includes require a JpaQuerySource, got "
                    + source.getClass().getName());
        };
    }
}
